package com.ospicorp.costforecast.forecast.model;

import java.util.Locale;

public enum DartsModel {
  EXPONENTIAL_SMOOTHING,
  ARIMA,
  AUTO_ARIMA,
  THETA,
  LINEAR_REGRESSION,
  RANDOM_FOREST,
  XGBOOST;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DartsModel fromCode(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown Darts model: " + value, ex);
    }
  }
}
