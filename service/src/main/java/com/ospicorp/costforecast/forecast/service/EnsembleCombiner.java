package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-position mean of the values that are present. Positions with no value in any input stay
 * missing.
 */
public final class EnsembleCombiner {

  private EnsembleCombiner() {
  }

  public static ForecastResult combine(Map<Algorithm, ForecastResult> results) {
    if (results.isEmpty()) {
      return new ForecastResult(Algorithm.ENSEMBLE, List.of());
    }
    // summed in enum order so the result does not depend on map iteration order
    List<ForecastResult> ordered = new ArrayList<>(results.size());
    for (Algorithm algorithm : EnumSet.copyOf(results.keySet())) {
      ordered.add(results.get(algorithm));
    }
    int size = 0;
    for (ForecastResult result : ordered) {
      size = Math.max(size, result.size());
    }

    List<Double> combined = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      double sum = 0d;
      int count = 0;
      for (ForecastResult result : ordered) {
        if (i < result.size() && result.value(i) != null) {
          sum += result.value(i);
          count++;
        }
      }
      combined.add(count == 0 ? null : sum / count);
    }
    return new ForecastResult(Algorithm.ENSEMBLE, combined);
  }

  /** Algorithms that supplied at least one value. */
  public static Set<Algorithm> contributors(Map<Algorithm, ForecastResult> results) {
    Set<Algorithm> contributors = EnumSet.noneOf(Algorithm.class);
    for (Map.Entry<Algorithm, ForecastResult> entry : results.entrySet()) {
      if (entry.getValue().hasAnyValue()) {
        contributors.add(entry.getKey());
      }
    }
    return contributors;
  }
}
