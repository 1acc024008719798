package com.ospicorp.costforecast.forecast.model;

final class OrderTerms {
  private OrderTerms() {
  }

  static int[] parse(String value, int expectedLength) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(
          "Order parameter must have " + expectedLength + " comma-separated values");
    }
    String[] parts = value.split(",");
    if (parts.length != expectedLength) {
      throw new IllegalArgumentException(
          "Order parameter must have " + expectedLength + " comma-separated values");
    }
    int[] terms = new int[expectedLength];
    for (int i = 0; i < parts.length; i++) {
      try {
        terms[i] = Integer.parseInt(parts[i].trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid order parameter format: " + value, ex);
      }
    }
    return terms;
  }
}
