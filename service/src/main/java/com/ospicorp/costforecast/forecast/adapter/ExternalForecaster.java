package com.ospicorp.costforecast.forecast.adapter;

import com.ospicorp.costforecast.forecast.algorithm.Forecaster;
import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.Diagnostic;
import com.ospicorp.costforecast.forecast.model.DiagnosticKind;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for methods that delegate to a {@link ForecastBackend}. Whatever happens on the backend
 * side, the caller gets one value or {@code null} per horizon position and, when values are
 * missing, a diagnostic saying why.
 */
public abstract class ExternalForecaster implements Forecaster {

  private static final Logger log = LoggerFactory.getLogger(ExternalForecaster.class);

  private final ForecastBackend backend;

  protected ExternalForecaster(ForecastBackend backend) {
    this.backend = backend;
  }

  /** Method specific settings sent along with the request. */
  protected abstract Map<String, Object> options(ForecastParameters parameters);

  /** Lets a subclass answer without calling the backend. */
  protected Optional<ForecastOutcome> shortCircuit(TimeSeries series, Horizon horizon) {
    return Optional.empty();
  }

  @Override
  public final ForecastOutcome forecast(TimeSeries series, Horizon horizon,
      ForecastParameters parameters) {
    Algorithm algorithm = algorithm();
    int size = horizon.size();
    if (!parameters.isEnabled(algorithm)) {
      return missing(algorithm, size, DiagnosticKind.BACKEND_DISABLED,
          algorithm.column() + " is disabled in configuration");
    }

    Optional<ForecastOutcome> early = shortCircuit(series, horizon);
    if (early.isPresent()) {
      return early.get();
    }

    BackendRequest request = new BackendRequest(algorithm.column(),
        horizon.granularity().name().toLowerCase(Locale.ROOT), BackendRequest.history(series),
        horizon.dates(), options(parameters));
    try {
      List<BackendPoint> points = backend.forecast(request);
      List<Double> aligned = NearestDateAligner.align(points, horizon.dates());
      ForecastResult result = new ForecastResult(algorithm, aligned);
      long nonFinite = aligned.stream()
          .filter(value -> value != null && !Double.isFinite(value))
          .count();
      log.debug("{} returned {} points for {} horizon dates", backend.name(), points.size(), size);
      if (nonFinite > 0) {
        return ForecastOutcome.of(result, new Diagnostic(algorithm,
            DiagnosticKind.NON_FINITE_VALUES,
            nonFinite + " " + algorithm.column()
                + " values were not finite and are reported as missing"));
      }
      return ForecastOutcome.of(result);
    } catch (BackendUnavailableException ex) {
      return missing(algorithm, size, DiagnosticKind.BACKEND_UNAVAILABLE, ex.getMessage());
    } catch (BackendException ex) {
      return missing(algorithm, size, DiagnosticKind.BACKEND_FAILED, ex.getMessage());
    } catch (RuntimeException ex) {
      log.warn("{} failed unexpectedly for {}", backend.name(), algorithm.column(), ex);
      return missing(algorithm, size, DiagnosticKind.BACKEND_FAILED,
          algorithm.column() + " failed: " + ex);
    }
  }

  private static ForecastOutcome missing(Algorithm algorithm, int size, DiagnosticKind kind,
      String message) {
    return ForecastOutcome.of(ForecastResult.missing(algorithm, size),
        new Diagnostic(algorithm, kind, message));
  }
}
