package com.ospicorp.costforecast.forecast.model;

import java.util.List;

/** ARIMA-style {@code (p, d, q)} order. */
public record ModelOrder(int p, int d, int q) {

  public ModelOrder {
    if (p < 0 || d < 0 || q < 0) {
      throw new IllegalArgumentException("order terms must be non-negative");
    }
  }

  public static ModelOrder parse(String value) {
    int[] terms = OrderTerms.parse(value, 3);
    return new ModelOrder(terms[0], terms[1], terms[2]);
  }

  public List<Integer> asList() {
    return List.of(p, d, q);
  }

  @Override
  public String toString() {
    return p + "," + d + "," + q;
  }
}
