package com.ospicorp.costforecast.forecast.algorithm;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

/**
 * Theta method: a least-squares line over the observation index combined with the theta line
 * {@code theta * (v - trend) + trend}, whose last increment is carried one step forward.
 */
@Component
public class ThetaForecaster implements Forecaster {

  @Override
  public Algorithm algorithm() {
    return Algorithm.THETA;
  }

  @Override
  public ForecastOutcome forecast(TimeSeries series, Horizon horizon,
      ForecastParameters parameters) {
    double[] values = series.values();
    int n = values.length;
    if (n < 2) {
      return ForecastOutcome.of(
          ForecastResult.constant(Algorithm.THETA, values[n - 1], horizon.size()));
    }

    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < n; i++) {
      regression.addData(i, values[i]);
    }
    double slope = regression.getSlope();
    double intercept = regression.getIntercept();
    double theta = parameters.theta();

    double lastTrend = slope * (n - 1) + intercept;
    double previousTrend = slope * (n - 2) + intercept;
    double lastThetaLine = theta * (values[n - 1] - lastTrend) + lastTrend;
    double previousThetaLine = theta * (values[n - 2] - previousTrend) + previousTrend;
    double thetaStep = lastThetaLine + (lastThetaLine - previousThetaLine);

    List<Double> forecasts = new ArrayList<>(horizon.size());
    for (int h = 1; h <= horizon.size(); h++) {
      double trendForecast = slope * (n + h - 1) + intercept;
      forecasts.add(trendForecast + (thetaStep - lastTrend));
    }
    return ForecastOutcome.of(new ForecastResult(Algorithm.THETA, forecasts));
  }
}
