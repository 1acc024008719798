package com.ospicorp.costforecast.forecast.algorithm;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.costforecast.TestSeries;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.series.model.Granularity;
import org.junit.jupiter.api.Test;

class ExponentialSmoothingForecasterTest {

  private final ExponentialSmoothingForecaster forecaster = new ExponentialSmoothingForecaster();

  @Test
  void followsTheSmoothingRecurrence() {
    // s0 = 10, s1 = 13, s2 = 18.1, s3 = 24.67, s4 = 32.269
    assertEquals(32.269, ExponentialSmoothingForecaster.smooth(
        new double[] {10, 20, 30, 40, 50}, 0.3), 1e-9);
  }

  @Test
  void alphaOneRepeatsLastValue() {
    assertEquals(50.0, ExponentialSmoothingForecaster.smooth(
        new double[] {10, 20, 30, 40, 50}, 1.0));
  }

  @Test
  void recomputationIsBitIdentical() {
    var series = TestSeries.daily(10, 20, 30, 40, 50);
    var horizon = TestSeries.horizonAfter(series, Granularity.DAILY);
    var parameters = ForecastParameters.defaults().withEsAlpha(0.3);

    var first = forecaster.forecast(series, horizon, parameters).result();
    var second = forecaster.forecast(series, horizon, parameters).result();

    assertEquals(first, second);
    assertEquals(365, first.size());
    assertEquals(first.value(0), first.value(364));
  }
}
