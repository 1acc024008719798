package com.ospicorp.costforecast.forecast.adapter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.costforecast.series.model.DataPoint;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Payload sent to an external forecasting backend.
 *
 * @param algorithm output column of the requested method, e.g. {@code prophet}
 * @param granularity {@code daily} or {@code monthly}
 * @param history observed points, oldest first
 * @param horizon dates the caller wants values for
 * @param options method specific settings
 */
public record BackendRequest(
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("granularity") String granularity,
    @JsonProperty("history") List<BackendPoint> history,
    @JsonProperty("horizon") List<LocalDate> horizon,
    @JsonProperty("options") Map<String, Object> options
) {

  public BackendRequest {
    history = List.copyOf(history);
    horizon = List.copyOf(horizon);
    options = Map.copyOf(options);
  }

  static List<BackendPoint> history(TimeSeries series) {
    List<BackendPoint> points = new ArrayList<>(series.size());
    for (DataPoint point : series.points()) {
      points.add(new BackendPoint(point.date(), point.value()));
    }
    return points;
  }
}
