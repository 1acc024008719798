package com.ospicorp.costforecast.forecast.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Values of one algorithm aligned 1:1 with the horizon. A {@code null} entry means the value is
 * unavailable at that position.
 */
public final class ForecastResult {

  private final Algorithm algorithm;
  private final List<Double> values;

  public ForecastResult(Algorithm algorithm, List<Double> values) {
    this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    List<Double> copy = new ArrayList<>(values.size());
    for (Double value : values) {
      copy.add(value == null || !Double.isFinite(value) ? null : value);
    }
    this.values = Collections.unmodifiableList(copy);
  }

  public static ForecastResult missing(Algorithm algorithm, int size) {
    return new ForecastResult(algorithm, Collections.nCopies(size, null));
  }

  public static ForecastResult constant(Algorithm algorithm, double value, int size) {
    return new ForecastResult(algorithm, Collections.nCopies(size, value));
  }

  public Algorithm algorithm() {
    return algorithm;
  }

  public List<Double> values() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public Double value(int index) {
    return values.get(index);
  }

  public boolean hasAnyValue() {
    for (Double value : values) {
      if (value != null) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ForecastResult other)) {
      return false;
    }
    return algorithm == other.algorithm && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(algorithm, values);
  }

  @Override
  public String toString() {
    return "ForecastResult[" + algorithm.column() + ", " + values.size() + " values]";
  }
}
