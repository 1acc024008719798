package com.ospicorp.costforecast.forecast.model;

import java.util.Locale;

/**
 * Forecasting methods in output column order. The declaration order is the column order of the
 * assembled table.
 */
public enum Algorithm {
  SMA("sma", false),
  ES("es", false),
  HW("hw", false),
  ARIMA("arima", true),
  SARIMA("sarima", true),
  THETA("theta", false),
  PROPHET("prophet", true),
  NEURAL_PROPHET("neural_prophet", true),
  DARTS("darts", true),
  ENSEMBLE("ensemble", false);

  private final String column;
  private final boolean external;

  Algorithm(String column, boolean external) {
    this.column = column;
    this.external = external;
  }

  public String column() {
    return column;
  }

  /** True when values come from an external engine through an adapter. */
  public boolean external() {
    return external;
  }

  public static Algorithm fromColumn(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (Algorithm algorithm : values()) {
      if (algorithm.column.equals(normalized)) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException("Unknown algorithm: " + value);
  }
}
