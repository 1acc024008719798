package com.ospicorp.costforecast.forecast.adapter;

import java.util.List;

/**
 * Transport to an engine that fits and predicts outside the JVM.
 *
 * <p>Implementations throw {@link BackendUnavailableException} when the engine cannot be reached
 * or lacks the requested library, and {@link BackendException} when the engine fails.
 */
public interface ForecastBackend {

  List<BackendPoint> forecast(BackendRequest request);

  /** Short label used in log lines and diagnostics. */
  String name();
}
