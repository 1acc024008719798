package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Milestone;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.Map;

/**
 * Calendar period ends relative to the last observed date. An anchor that already sits on a
 * period end rolls to the next one, so "end of this month" for 2024-01-31 is 2024-02-29.
 */
public final class MilestoneCalendar {

  private MilestoneCalendar() {
  }

  public static Map<Milestone, LocalDate> milestones(LocalDate lastDate) {
    Map<Milestone, LocalDate> dates = new EnumMap<>(Milestone.class);
    dates.put(Milestone.END_OF_THIS_MONTH, monthEnd(lastDate, 1));
    dates.put(Milestone.END_OF_NEXT_MONTH, monthEnd(lastDate, 2));
    dates.put(Milestone.END_OF_NEXT_QUARTER, quarterEnd(lastDate, 1));
    dates.put(Milestone.END_OF_FOLLOWING_QUARTER, quarterEnd(lastDate, 2));
    dates.put(Milestone.END_OF_YEAR, yearEnd(lastDate));
    return dates;
  }

  static LocalDate monthEnd(LocalDate anchor, int periods) {
    YearMonth month = YearMonth.from(anchor);
    if (anchor.equals(month.atEndOfMonth())) {
      month = month.plusMonths(1);
    }
    return month.plusMonths(periods - 1L).atEndOfMonth();
  }

  static LocalDate quarterEnd(LocalDate anchor, int periods) {
    int quarterEndMonth = ((anchor.getMonthValue() - 1) / 3 + 1) * 3;
    YearMonth quarter = YearMonth.of(anchor.getYear(), quarterEndMonth);
    if (anchor.equals(quarter.atEndOfMonth())) {
      quarter = quarter.plusMonths(3);
    }
    return quarter.plusMonths(3L * (periods - 1)).atEndOfMonth();
  }

  static LocalDate yearEnd(LocalDate anchor) {
    LocalDate end = LocalDate.of(anchor.getYear(), Month.DECEMBER, 31);
    return anchor.equals(end) ? end.plusYears(1) : end;
  }
}
