package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.forecast.model.Milestone;
import com.ospicorp.costforecast.forecast.model.MilestoneTotal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums each algorithm's values from the start of the horizon through every milestone date.
 * Missing values count as zero, so an algorithm with no values totals 0.
 */
public final class MilestoneAggregator {

  private MilestoneAggregator() {
  }

  public static List<MilestoneTotal> aggregate(LocalDate lastDate, Horizon horizon,
      Map<Algorithm, ForecastResult> results) {
    List<MilestoneTotal> totals = new ArrayList<>();
    for (Map.Entry<Milestone, LocalDate> milestone : MilestoneCalendar.milestones(lastDate)
        .entrySet()) {
      LocalDate cutoff = milestone.getValue();
      Map<Algorithm, Double> sums = new LinkedHashMap<>();
      for (Map.Entry<Algorithm, ForecastResult> entry : results.entrySet()) {
        sums.put(entry.getKey(), sumThrough(horizon, entry.getValue(), cutoff));
      }
      totals.add(new MilestoneTotal(milestone.getKey(), cutoff, sums));
    }
    return totals;
  }

  private static double sumThrough(Horizon horizon, ForecastResult result, LocalDate cutoff) {
    double sum = 0d;
    int limit = Math.min(horizon.size(), result.size());
    for (int i = 0; i < limit; i++) {
      if (horizon.date(i).isAfter(cutoff)) {
        break;
      }
      Double value = result.value(i);
      if (value != null) {
        sum += value;
      }
    }
    return sum;
  }
}
