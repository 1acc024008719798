package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.Diagnostic;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.forecast.model.MilestoneTotal;
import com.ospicorp.costforecast.series.model.Granularity;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Everything one forecasting run produced. */
public record ForecastReport(
    TimeSeries series,
    Granularity granularity,
    Horizon horizon,
    Map<Algorithm, ForecastResult> results,
    Set<Algorithm> ensembleContributors,
    List<MilestoneTotal> milestones,
    List<Diagnostic> diagnostics,
    List<ForecastRow> rows
) {

  public ForecastReport {
    Map<Algorithm, ForecastResult> ordered = new EnumMap<>(Algorithm.class);
    ordered.putAll(results);
    results = Collections.unmodifiableMap(ordered);
    ensembleContributors = Set.copyOf(ensembleContributors);
    milestones = List.copyOf(milestones);
    diagnostics = List.copyOf(diagnostics);
    rows = List.copyOf(rows);
  }

  /** Output columns in table order. */
  public List<Algorithm> columns() {
    return OutputAssembler.columns(results.keySet());
  }

  public ForecastResult result(Algorithm algorithm) {
    return results.get(algorithm);
  }
}
