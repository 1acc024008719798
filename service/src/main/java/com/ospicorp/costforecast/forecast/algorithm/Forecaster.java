package com.ospicorp.costforecast.forecast.algorithm;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.TimeSeries;

/**
 * One forecasting method.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>return exactly one value (or {@code null}) per horizon position</li>
 *   <li>not throw for conditions of the data or the backend; those become missing values plus a
 *       diagnostic on the returned {@link ForecastOutcome}</li>
 *   <li>keep no state between calls</li>
 * </ul>
 */
public interface Forecaster {

  Algorithm algorithm();

  ForecastOutcome forecast(TimeSeries series, Horizon horizon, ForecastParameters parameters);
}
