package com.ospicorp.costforecast.forecast.adapter;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ArimaForecaster extends ExternalForecaster {

  public ArimaForecaster(ForecastBackend backend) {
    super(backend);
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.ARIMA;
  }

  @Override
  protected Map<String, Object> options(ForecastParameters parameters) {
    return Map.of("order", parameters.arima().order().asList());
  }
}
