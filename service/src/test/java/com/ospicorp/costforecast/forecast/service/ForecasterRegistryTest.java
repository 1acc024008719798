package com.ospicorp.costforecast.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.costforecast.forecast.adapter.DartsForecaster;
import com.ospicorp.costforecast.forecast.adapter.NeuralProphetForecaster;
import com.ospicorp.costforecast.forecast.adapter.NoopForecastBackend;
import com.ospicorp.costforecast.forecast.adapter.ProphetForecaster;
import com.ospicorp.costforecast.forecast.algorithm.ExponentialSmoothingForecaster;
import com.ospicorp.costforecast.forecast.algorithm.SimpleMovingAverageForecaster;
import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import java.util.List;
import org.junit.jupiter.api.Test;

class ForecasterRegistryTest {

  private final NoopForecastBackend backend = new NoopForecastBackend();

  private final ForecasterRegistry registry = new ForecasterRegistry(List.of(
      new DartsForecaster(backend),
      new ProphetForecaster(backend),
      new SimpleMovingAverageForecaster(),
      new NeuralProphetForecaster(backend),
      new ExponentialSmoothingForecaster()));

  @Test
  void defaultSelectionLeavesOutOptInMethods() {
    assertEquals(List.of(Algorithm.SMA, Algorithm.ES, Algorithm.PROPHET),
        registry.defaultSelection(ForecastParameters.defaults()));
  }

  @Test
  void enabledOptInMethodsJoinTheDefaultSelection() {
    var parameters = ForecastParameters.defaults()
        .withNeuralProphet(new ForecastParameters.NeuralProphet(true));

    assertEquals(List.of(Algorithm.SMA, Algorithm.ES, Algorithm.PROPHET, Algorithm.NEURAL_PROPHET),
        registry.defaultSelection(parameters));
  }

  @Test
  void lookupAndDuplicates() {
    assertTrue(registry.find(Algorithm.SMA).isPresent());
    assertTrue(registry.find(Algorithm.THETA).isEmpty());
    assertEquals(5, registry.available().size());
    assertThrows(IllegalStateException.class, () -> new ForecasterRegistry(List.of(
        new SimpleMovingAverageForecaster(), new SimpleMovingAverageForecaster())));
  }
}
