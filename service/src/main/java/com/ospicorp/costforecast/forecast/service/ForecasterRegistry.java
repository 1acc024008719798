package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.algorithm.Forecaster;
import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Looks up forecasters by algorithm and decides which ones run by default. */
@Component
public class ForecasterRegistry {

  private final Map<Algorithm, Forecaster> forecasters = new EnumMap<>(Algorithm.class);

  public ForecasterRegistry(List<Forecaster> forecasters) {
    for (Forecaster forecaster : forecasters) {
      Forecaster previous = this.forecasters.put(forecaster.algorithm(), forecaster);
      if (previous != null) {
        throw new IllegalStateException("Two forecasters registered for "
            + forecaster.algorithm().column() + ": " + previous.getClass().getSimpleName()
            + " and " + forecaster.getClass().getSimpleName());
      }
    }
  }

  public Optional<Forecaster> find(Algorithm algorithm) {
    return Optional.ofNullable(forecasters.get(algorithm));
  }

  public Set<Algorithm> available() {
    return Collections.unmodifiableSet(forecasters.keySet());
  }

  /**
   * Methods run when the caller does not pick any: every registered method except NeuralProphet
   * and Darts, which join only when enabled. ARIMA, SARIMA and Prophet always get a column, empty
   * when their backend is switched off.
   */
  public List<Algorithm> defaultSelection(ForecastParameters parameters) {
    List<Algorithm> selection = new ArrayList<>();
    for (Algorithm algorithm : forecasters.keySet()) {
      boolean optIn = algorithm == Algorithm.NEURAL_PROPHET || algorithm == Algorithm.DARTS;
      if (!optIn || parameters.isEnabled(algorithm)) {
        selection.add(algorithm);
      }
    }
    return selection;
  }
}
