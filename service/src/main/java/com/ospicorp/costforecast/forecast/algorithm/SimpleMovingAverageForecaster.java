package com.ospicorp.costforecast.forecast.algorithm;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.TimeSeries;
import org.springframework.stereotype.Component;

/** Flat forecast at the trailing mean of the last {@code window} observations. */
@Component
public class SimpleMovingAverageForecaster implements Forecaster {

  @Override
  public Algorithm algorithm() {
    return Algorithm.SMA;
  }

  @Override
  public ForecastOutcome forecast(TimeSeries series, Horizon horizon,
      ForecastParameters parameters) {
    double mean = trailingMean(series.values(), parameters.smaWindow());
    return ForecastOutcome.of(ForecastResult.constant(Algorithm.SMA, mean, horizon.size()));
  }

  /** Mean of the last {@code min(window, values.length)} values. */
  static double trailingMean(double[] values, int window) {
    int count = Math.min(window, values.length);
    double sum = 0d;
    for (int i = values.length - count; i < values.length; i++) {
      sum += values[i];
    }
    return sum / count;
  }
}
