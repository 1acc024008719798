package com.ospicorp.costforecast.forecast.algorithm;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.costforecast.TestSeries;
import com.ospicorp.costforecast.forecast.model.DiagnosticKind;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.series.model.Granularity;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class HoltWintersForecasterTest {

  private final HoltWintersForecaster forecaster = new HoltWintersForecaster();

  private static double[] seasonal(int length) {
    double[] values = new double[length];
    for (int i = 0; i < length; i++) {
      values[i] = (100 + 2 * i) * (1 + 0.2 * Math.sin(2 * Math.PI * i / 12));
    }
    return values;
  }

  @Test
  void shortSeriesFallsBackToExponentialSmoothingWithHoltWintersAlpha() {
    var series = TestSeries.daily(10, 20, 30, 40, 50, 60, 70, 80, 90, 100);
    var horizon = TestSeries.horizonAfter(series, Granularity.DAILY);
    var parameters = ForecastParameters.defaults();

    var outcome = forecaster.forecast(series, horizon, parameters);
    var es = new ExponentialSmoothingForecaster().forecast(series, horizon,
        parameters.withEsAlpha(parameters.holtWinters().alpha()));

    assertEquals(es.result().values(), outcome.result().values());
    assertEquals(1, outcome.diagnostics().size());
    assertEquals(DiagnosticKind.HOLT_WINTERS_FALLBACK, outcome.diagnostics().get(0).kind());
  }

  @Test
  void matchesTheMultiplicativeRecurrence() {
    double[] values = seasonal(36);
    var series = TestSeries.monthly(LocalDate.of(2021, 1, 1), values);
    var horizon = TestSeries.horizonAfter(series, Granularity.MONTHLY);

    var outcome = forecaster.forecast(series, horizon, ForecastParameters.defaults());

    double[] expected = reference(values, 0.3, 0.1, 0.1, 12, 12);
    assertTrue(outcome.diagnostics().isEmpty());
    assertEquals(12, outcome.result().size());
    for (int h = 0; h < 12; h++) {
      assertNotNull(outcome.result().value(h));
      assertEquals(expected[h], outcome.result().value(h), 1e-9);
    }
  }

  @Test
  void zeroSeasonProducesMissingValuesAndDiagnostic() {
    double[] values = new double[24];
    for (int i = 12; i < 24; i++) {
      values[i] = 5;
    }
    var series = TestSeries.monthly(LocalDate.of(2022, 1, 1), values);
    var horizon = TestSeries.horizonAfter(series, Granularity.MONTHLY);

    var outcome = forecaster.forecast(series, horizon, ForecastParameters.defaults());

    assertEquals(12, outcome.result().size());
    assertFalse(outcome.result().hasAnyValue());
    assertEquals(DiagnosticKind.NON_FINITE_VALUES, outcome.diagnostics().get(0).kind());
  }

  private static double[] reference(double[] v, double alpha, double beta, double gamma, int s,
      int steps) {
    int n = v.length;
    double[] level = new double[n];
    double[] trend = new double[n];
    double[] season = new double[n];
    double first = 0;
    double second = 0;
    for (int i = 0; i < s; i++) {
      first += v[i] / s;
      second += v[s + i] / s;
    }
    for (int i = 0; i < s; i++) {
      season[i] = v[i] / first;
    }
    level[s - 1] = first;
    trend[s - 1] = (second - first) / s;
    for (int i = s; i < n; i++) {
      level[i] = alpha * (v[i] / season[i - s]) + (1 - alpha) * (level[i - 1] + trend[i - 1]);
      trend[i] = beta * (level[i] - level[i - 1]) + (1 - beta) * trend[i - 1];
      season[i] = gamma * (v[i] / level[i]) + (1 - gamma) * season[i - s];
    }
    double[] out = new double[steps];
    for (int h = 1; h <= steps; h++) {
      out[h - 1] = (level[n - 1] + h * trend[n - 1]) * season[n - s + (h - 1) % s];
    }
    return out;
  }
}
