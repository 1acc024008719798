package com.ospicorp.costforecast.forecast.algorithm;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.Diagnostic;
import com.ospicorp.costforecast.forecast.model.DiagnosticKind;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

/**
 * Multiplicative Holt-Winters triple exponential smoothing.
 *
 * <p>Initialisation uses the first two seasons:
 * <pre>
 *   seasonal[i]  = v[i] / mean(v[0..s))          for i in [0, s)
 *   level[s-1]   = mean(v[0..s))
 *   trend[s-1]   = (mean(v[s..2s)) - mean(v[0..s))) / s
 * </pre>
 * then for {@code i >= s}:
 * <pre>
 *   level[i]    = alpha * v[i] / seasonal[i-s] + (1 - alpha) * (level[i-1] + trend[i-1])
 *   trend[i]    = beta * (level[i] - level[i-1]) + (1 - beta) * trend[i-1]
 *   seasonal[i] = gamma * v[i] / level[i] + (1 - gamma) * seasonal[i-s]
 * </pre>
 * and step {@code h} forecasts {@code (level[n-1] + h * trend[n-1]) * seasonal[n-s + (h-1) mod s]}.
 *
 * <p>With fewer than two full seasons the result is the exponential smoothing forecast computed
 * with the Holt-Winters {@code alpha}. Positions where a zero level or zero seasonal index makes
 * the recurrence non-finite are reported as missing.
 */
@Component
public class HoltWintersForecaster implements Forecaster {

  @Override
  public Algorithm algorithm() {
    return Algorithm.HW;
  }

  @Override
  public ForecastOutcome forecast(TimeSeries series, Horizon horizon,
      ForecastParameters parameters) {
    ForecastParameters.HoltWinters hw = parameters.holtWinters();
    double[] values = series.values();
    int s = hw.seasonalPeriods();
    int n = values.length;

    if (n < 2 * s) {
      double level = ExponentialSmoothingForecaster.smooth(values, hw.alpha());
      return ForecastOutcome.of(ForecastResult.constant(Algorithm.HW, level, horizon.size()),
          new Diagnostic(Algorithm.HW, DiagnosticKind.HOLT_WINTERS_FALLBACK,
              "Holt-Winters needs at least " + (2 * s) + " observations, found " + n
                  + "; using exponential smoothing"));
    }

    double[] level = new double[n];
    double[] trend = new double[n];
    double[] seasonal = new double[n];

    double firstSeasonMean = StatUtils.mean(values, 0, s);
    double secondSeasonMean = StatUtils.mean(values, s, s);
    for (int i = 0; i < s; i++) {
      seasonal[i] = values[i] / firstSeasonMean;
    }
    level[s - 1] = firstSeasonMean;
    trend[s - 1] = (secondSeasonMean - firstSeasonMean) / s;

    double alpha = hw.alpha();
    double beta = hw.beta();
    double gamma = hw.gamma();
    for (int i = s; i < n; i++) {
      level[i] = alpha * (values[i] / seasonal[i - s])
          + (1 - alpha) * (level[i - 1] + trend[i - 1]);
      trend[i] = beta * (level[i] - level[i - 1]) + (1 - beta) * trend[i - 1];
      seasonal[i] = gamma * (values[i] / level[i]) + (1 - gamma) * seasonal[i - s];
    }

    double lastLevel = level[n - 1];
    double lastTrend = trend[n - 1];
    int profileStart = n - s;
    List<Double> forecasts = new ArrayList<>(horizon.size());
    int nonFinite = 0;
    for (int h = 1; h <= horizon.size(); h++) {
      double value = (lastLevel + h * lastTrend) * seasonal[profileStart + (h - 1) % s];
      if (!Double.isFinite(value)) {
        nonFinite++;
      }
      forecasts.add(value);
    }

    ForecastResult result = new ForecastResult(Algorithm.HW, forecasts);
    if (nonFinite == 0) {
      return ForecastOutcome.of(result);
    }
    return ForecastOutcome.of(result, new Diagnostic(Algorithm.HW,
        DiagnosticKind.NON_FINITE_VALUES,
        nonFinite + " Holt-Winters values were not finite (zero level or seasonal index)"
            + " and are reported as missing"));
  }
}
