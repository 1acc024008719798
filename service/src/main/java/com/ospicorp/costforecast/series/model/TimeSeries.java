package com.ospicorp.costforecast.series.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cleaned historical series handed to the forecasters. Dates are strictly increasing and every
 * value is finite; instances are immutable.
 */
public final class TimeSeries {

  private final List<DataPoint> points;

  private TimeSeries(List<DataPoint> points) {
    this.points = List.copyOf(points);
  }

  /**
   * Builds a series from points that are already cleaned.
   *
   * @throws IllegalArgumentException when dates are not strictly increasing or a value is missing
   *     or non-finite
   */
  public static TimeSeries of(List<DataPoint> points) {
    Objects.requireNonNull(points, "points");
    LocalDate previous = null;
    for (DataPoint point : points) {
      if (point.date() == null) {
        throw new IllegalArgumentException("date must be provided for every point");
      }
      if (point.value() == null || !Double.isFinite(point.value())) {
        throw new IllegalArgumentException("value on " + point.date() + " must be a finite number");
      }
      if (previous != null && !point.date().isAfter(previous)) {
        throw new IllegalArgumentException("dates must be strictly increasing, found "
            + point.date() + " after " + previous);
      }
      previous = point.date();
    }
    return new TimeSeries(points);
  }

  public List<DataPoint> points() {
    return points;
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public LocalDate firstDate() {
    return points.isEmpty() ? null : points.get(0).date();
  }

  public LocalDate lastDate() {
    return points.isEmpty() ? null : points.get(points.size() - 1).date();
  }

  public List<LocalDate> dates() {
    List<LocalDate> dates = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      dates.add(point.date());
    }
    return dates;
  }

  /** Returns a fresh copy of the values; callers may mutate it. */
  public double[] values() {
    double[] values = new double[points.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = points.get(i).value();
    }
    return values;
  }
}
