package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import java.util.List;

/**
 * Per-run switches.
 *
 * @param ensemble whether to add the ensemble column
 * @param include algorithms to run; empty means the registry's default selection
 */
public record ForecastOptions(boolean ensemble, List<Algorithm> include) {

  public ForecastOptions {
    include = include == null ? List.of() : List.copyOf(include);
  }

  public static ForecastOptions defaults() {
    return new ForecastOptions(false, List.of());
  }

  public static ForecastOptions withEnsemble(boolean ensemble) {
    return new ForecastOptions(ensemble, List.of());
  }
}
