package com.ospicorp.costforecast.forecast.model;

import com.ospicorp.costforecast.series.model.Granularity;
import java.time.LocalDate;
import java.util.List;

public record Horizon(Granularity granularity, List<LocalDate> dates) {

  public Horizon {
    dates = List.copyOf(dates);
  }

  public int size() {
    return dates.size();
  }

  public LocalDate date(int index) {
    return dates.get(index);
  }
}
