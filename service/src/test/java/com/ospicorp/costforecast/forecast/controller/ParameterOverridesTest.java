package com.ospicorp.costforecast.forecast.controller;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.costforecast.forecast.model.DartsModel;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ModelOrder;
import com.ospicorp.costforecast.forecast.model.SeasonalOrder;
import org.junit.jupiter.api.Test;

class ParameterOverridesTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private ParameterOverrides read(String json) throws Exception {
    return mapper.readValue(json, ParameterOverrides.class);
  }

  @Test
  void emptyOverridesKeepDefaults() throws Exception {
    var base = ForecastParameters.defaults();

    assertEquals(base, read("{}").applyTo(base));
  }

  @Test
  void overridesOnlyTheGivenFields() throws Exception {
    var overrides = read("""
        {"sma_window": 3, "hw_gamma": 0.2, "sarima": true,
         "sarima_seasonal_order": "0,1,1,7", "prophet_weekly_seasonality": true,
         "darts_algorithm": "theta"}
        """);

    var parameters = overrides.applyTo(ForecastParameters.defaults());

    assertEquals(3, parameters.smaWindow());
    assertEquals(0.5, parameters.esAlpha());
    assertEquals(0.2, parameters.holtWinters().gamma());
    assertEquals(0.3, parameters.holtWinters().alpha());
    assertTrue(parameters.sarima().enabled());
    assertEquals(new ModelOrder(1, 1, 1), parameters.sarima().order());
    assertEquals(new SeasonalOrder(0, 1, 1, 7), parameters.sarima().seasonalOrder());
    assertTrue(parameters.prophet().weeklySeasonality());
    assertTrue(parameters.prophet().enabled());
    assertTrue(parameters.darts().enabled());
    assertEquals(DartsModel.THETA, parameters.darts().model());
  }

  @Test
  void rejectedValuesCarryTheirErrorCode() throws Exception {
    var window = assertThrows(InvalidParameterException.class,
        () -> read("{\"sma_window\": 0}").applyTo(ForecastParameters.defaults()));
    var alpha = assertThrows(InvalidParameterException.class,
        () -> read("{\"es_alpha\": 1.5}").applyTo(ForecastParameters.defaults()));
    var sarima = assertThrows(InvalidParameterException.class,
        () -> read("{\"sarima_order\": \"a,b,c\"}").applyTo(ForecastParameters.defaults()));
    var darts = assertThrows(InvalidParameterException.class,
        () -> read("{\"darts_algorithm\": \"tcn\"}").applyTo(ForecastParameters.defaults()));

    assertEquals(2001, window.errorCode());
    assertEquals(2002, alpha.errorCode());
    assertEquals(2006, sarima.errorCode());
    assertEquals("Invalid order parameter format: a,b,c", sarima.getMessage());
    assertEquals(2008, darts.errorCode());
    assertEquals("https://docs.cost-forecast.dev/errors/2008", darts.moreInfo());
  }
}
