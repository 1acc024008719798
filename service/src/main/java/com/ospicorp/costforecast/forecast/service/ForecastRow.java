package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One line of the merged table. Historical rows carry {@code actual} and no forecasts; horizon
 * rows carry forecasts and no {@code actual}.
 */
public record ForecastRow(LocalDate date, Double actual, Map<Algorithm, Double> forecasts) {

  public ForecastRow {
    Map<Algorithm, Double> copy = new EnumMap<>(Algorithm.class);
    copy.putAll(forecasts);
    forecasts = Collections.unmodifiableMap(copy);
  }

  public boolean historical() {
    return actual != null;
  }

  public Double forecast(Algorithm algorithm) {
    return forecasts.get(algorithm);
  }
}
