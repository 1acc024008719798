package com.ospicorp.costforecast.forecast.adapter;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.Diagnostic;
import com.ospicorp.costforecast.forecast.model.DiagnosticKind;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * NeuralProphet shares Prophet's seasonality switches. A constant series never reaches the
 * backend: it is forecast as its last value.
 */
@Component
public class NeuralProphetForecaster extends ExternalForecaster {

  private static final double RELATIVE_TOLERANCE = 1e-5;
  private static final double ABSOLUTE_TOLERANCE = 1e-8;

  public NeuralProphetForecaster(ForecastBackend backend) {
    super(backend);
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.NEURAL_PROPHET;
  }

  @Override
  protected Map<String, Object> options(ForecastParameters parameters) {
    return ProphetForecaster.seasonalityOptions(parameters.prophet());
  }

  @Override
  protected Optional<ForecastOutcome> shortCircuit(TimeSeries series, Horizon horizon) {
    double[] values = series.values();
    if (!isConstant(values)) {
      return Optional.empty();
    }
    double last = values[values.length - 1];
    return Optional.of(ForecastOutcome.of(
        ForecastResult.constant(Algorithm.NEURAL_PROPHET, last, horizon.size()),
        new Diagnostic(Algorithm.NEURAL_PROPHET, DiagnosticKind.CONSTANT_SERIES_FALLBACK,
            "Input series is constant; neural_prophet repeats the last value")));
  }

  static boolean isConstant(double[] values) {
    double first = values[0];
    for (double value : values) {
      if (Math.abs(value - first) > ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(first)) {
        return false;
      }
    }
    return true;
  }
}
