package com.ospicorp.costforecast.series.service;

public class InsufficientDataException extends RuntimeException {
  private final int validPoints;
  private final int requiredPoints;

  public InsufficientDataException(int validPoints, int requiredPoints) {
    super("Not enough data to forecast. At least " + requiredPoints
        + " dates are required, found " + validPoints + ".");
    this.validPoints = validPoints;
    this.requiredPoints = requiredPoints;
  }

  public int validPoints() {
    return validPoints;
  }

  public int requiredPoints() {
    return requiredPoints;
  }
}
