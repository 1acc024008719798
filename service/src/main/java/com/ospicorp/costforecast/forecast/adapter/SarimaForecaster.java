package com.ospicorp.costforecast.forecast.adapter;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class SarimaForecaster extends ExternalForecaster {

  public SarimaForecaster(ForecastBackend backend) {
    super(backend);
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.SARIMA;
  }

  @Override
  protected Map<String, Object> options(ForecastParameters parameters) {
    ForecastParameters.Sarima sarima = parameters.sarima();
    return Map.of(
        "order", sarima.order().asList(),
        "seasonal_order", sarima.seasonalOrder().asList());
  }
}
