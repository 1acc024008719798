package com.ospicorp.costforecast.series.service;

import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.Granularity;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class HorizonGenerator {

  public static final int DAILY_STEPS = 365;
  public static final int MONTHLY_STEPS = 12;

  private HorizonGenerator() {
  }

  public static Horizon generate(LocalDate lastDate, Granularity granularity) {
    Objects.requireNonNull(lastDate, "lastDate");
    Objects.requireNonNull(granularity, "granularity");
    List<LocalDate> dates;
    if (granularity == Granularity.MONTHLY) {
      dates = new ArrayList<>(MONTHLY_STEPS);
      LocalDate monthStart = lastDate.withDayOfMonth(1);
      for (int i = 1; i <= MONTHLY_STEPS; i++) {
        dates.add(monthStart.plusMonths(i));
      }
    } else {
      dates = new ArrayList<>(DAILY_STEPS);
      for (int i = 1; i <= DAILY_STEPS; i++) {
        dates.add(lastDate.plusDays(i));
      }
    }
    return new Horizon(granularity, dates);
  }
}
