package com.ospicorp.costforecast.forecast.algorithm;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.TimeSeries;
import org.springframework.stereotype.Component;

/** Simple exponential smoothing; the last smoothed level is repeated over the horizon. */
@Component
public class ExponentialSmoothingForecaster implements Forecaster {

  @Override
  public Algorithm algorithm() {
    return Algorithm.ES;
  }

  @Override
  public ForecastOutcome forecast(TimeSeries series, Horizon horizon,
      ForecastParameters parameters) {
    double level = smooth(series.values(), parameters.esAlpha());
    return ForecastOutcome.of(ForecastResult.constant(Algorithm.ES, level, horizon.size()));
  }

  static double smooth(double[] values, double alpha) {
    double level = values[0];
    for (int i = 1; i < values.length; i++) {
      level = alpha * values[i] + (1 - alpha) * level;
    }
    return level;
  }
}
