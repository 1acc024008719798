package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.MilestoneTotal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text milestone report:
 * <pre>
 * # Forecast Milestone Summary
 *
 * end_of_this_month (2024-01-31):
 *   sma: 310.00
 *   es: 305.12
 *
 * </pre>
 */
public final class MilestoneSummaryFormatter {

  static final String TITLE = "# Forecast Milestone Summary";

  private MilestoneSummaryFormatter() {
  }

  public static String format(List<MilestoneTotal> totals) {
    StringBuilder out = new StringBuilder(TITLE).append("\n\n");
    for (MilestoneTotal total : totals) {
      out.append(total.milestone().label())
          .append(" (").append(total.date()).append("):\n");
      for (Map.Entry<Algorithm, Double> entry : total.totals().entrySet()) {
        out.append(String.format(Locale.ROOT, "  %s: %.2f", entry.getKey().column(),
            entry.getValue())).append('\n');
      }
      out.append('\n');
    }
    return out.toString();
  }
}
