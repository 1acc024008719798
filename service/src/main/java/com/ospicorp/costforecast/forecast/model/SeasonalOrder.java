package com.ospicorp.costforecast.forecast.model;

import java.util.List;

/** SARIMA seasonal order {@code (P, D, Q, s)}. */
public record SeasonalOrder(int p, int d, int q, int period) {

  public SeasonalOrder {
    if (p < 0 || d < 0 || q < 0) {
      throw new IllegalArgumentException("seasonal order terms must be non-negative");
    }
    if (period < 0) {
      throw new IllegalArgumentException("seasonal period must be non-negative");
    }
  }

  public static SeasonalOrder parse(String value) {
    int[] terms = OrderTerms.parse(value, 4);
    return new SeasonalOrder(terms[0], terms[1], terms[2], terms[3]);
  }

  public List<Integer> asList() {
    return List.of(p, d, q, period);
  }

  @Override
  public String toString() {
    return p + "," + d + "," + q + "," + period;
  }
}
