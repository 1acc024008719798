package com.ospicorp.costforecast.series.service;

import com.ospicorp.costforecast.series.model.Granularity;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;

public final class GranularityInferencer {
  private GranularityInferencer() {
  }

  public static Granularity infer(TimeSeries series) {
    return infer(series.dates());
  }

  /**
   * Monthly when every date is the first of its month, or when every date is a month end and
   * consecutive dates fall in consecutive months; daily otherwise. A series on the same mid-month
   * day each month has no month anchored step and is daily.
   */
  public static Granularity infer(List<LocalDate> dates) {
    if (dates.isEmpty()) {
      return Granularity.DAILY;
    }
    boolean allFirstOfMonth = dates.stream().allMatch(date -> date.getDayOfMonth() == 1);
    if (allFirstOfMonth) {
      return Granularity.MONTHLY;
    }
    return hasMonthlyStep(dates) ? Granularity.MONTHLY : Granularity.DAILY;
  }

  // fewer than three dates never count as a regular step
  private static boolean hasMonthlyStep(List<LocalDate> dates) {
    if (dates.size() < 3) {
      return false;
    }
    for (int i = 1; i < dates.size(); i++) {
      if (!isOneMonthApart(dates.get(i - 1), dates.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isOneMonthApart(LocalDate previous, LocalDate current) {
    return isMonthEnd(previous) && isMonthEnd(current)
        && ChronoUnit.MONTHS.between(YearMonth.from(previous), YearMonth.from(current)) == 1;
  }

  private static boolean isMonthEnd(LocalDate date) {
    return date.equals(YearMonth.from(date).atEndOfMonth());
  }
}
