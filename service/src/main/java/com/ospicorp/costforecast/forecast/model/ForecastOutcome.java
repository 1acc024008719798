package com.ospicorp.costforecast.forecast.model;

import java.util.List;

public record ForecastOutcome(ForecastResult result, List<Diagnostic> diagnostics) {

  public ForecastOutcome {
    diagnostics = List.copyOf(diagnostics);
  }

  public static ForecastOutcome of(ForecastResult result) {
    return new ForecastOutcome(result, List.of());
  }

  public static ForecastOutcome of(ForecastResult result, Diagnostic diagnostic) {
    return new ForecastOutcome(result, List.of(diagnostic));
  }
}
