package com.ospicorp.costforecast.forecast.adapter;

import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when no backend is configured: every external method degrades to missing values. */
@Component
@ConditionalOnProperty(name = "forecast.backend.type", havingValue = "none", matchIfMissing = true)
public class NoopForecastBackend implements ForecastBackend {

  @Override
  public String name() {
    return "no backend";
  }

  @Override
  public List<BackendPoint> forecast(BackendRequest request) {
    throw new BackendUnavailableException("No forecast backend is configured for "
        + request.algorithm() + " (set forecast.backend.type to 'process' or 'http')");
  }
}
