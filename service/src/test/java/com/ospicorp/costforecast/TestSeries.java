package com.ospicorp.costforecast;

import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.DataPoint;
import com.ospicorp.costforecast.series.model.Granularity;
import com.ospicorp.costforecast.series.model.TimeSeries;
import com.ospicorp.costforecast.series.service.HorizonGenerator;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Series fixtures shared by unit tests. */
public final class TestSeries {

  private TestSeries() {
  }

  public static TimeSeries daily(LocalDate start, double... values) {
    List<DataPoint> points = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(new DataPoint(start.plusDays(i), values[i]));
    }
    return TimeSeries.of(points);
  }

  public static TimeSeries daily(double... values) {
    return daily(LocalDate.of(2024, 1, 1), values);
  }

  public static TimeSeries monthly(LocalDate firstMonth, double... values) {
    List<DataPoint> points = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(new DataPoint(firstMonth.plusMonths(i), values[i]));
    }
    return TimeSeries.of(points);
  }

  public static Horizon horizonAfter(TimeSeries series, Granularity granularity) {
    return HorizonGenerator.generate(series.lastDate(), granularity);
  }
}
