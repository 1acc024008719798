package com.ospicorp.costforecast.forecast.adapter;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Darts runs one of its models, chosen by {@code forecast.darts.model}. */
@Component
public class DartsForecaster extends ExternalForecaster {

  public DartsForecaster(ForecastBackend backend) {
    super(backend);
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.DARTS;
  }

  @Override
  protected Map<String, Object> options(ForecastParameters parameters) {
    return Map.of("model", parameters.darts().model().code());
  }
}
