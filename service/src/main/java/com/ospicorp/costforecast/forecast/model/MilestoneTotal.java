package com.ospicorp.costforecast.forecast.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Cumulative forecast totals from the horizon start through {@code date}, per algorithm. */
public record MilestoneTotal(Milestone milestone, LocalDate date, Map<Algorithm, Double> totals) {

  public MilestoneTotal {
    totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
  }

  public double total(Algorithm algorithm) {
    return totals.getOrDefault(algorithm, 0d);
  }
}
