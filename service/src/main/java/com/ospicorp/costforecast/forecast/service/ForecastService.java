package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.algorithm.Forecaster;
import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.Diagnostic;
import com.ospicorp.costforecast.forecast.model.DiagnosticKind;
import com.ospicorp.costforecast.forecast.model.ForecastOutcome;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.forecast.model.MilestoneTotal;
import com.ospicorp.costforecast.series.model.Granularity;
import com.ospicorp.costforecast.series.model.TimeSeries;
import com.ospicorp.costforecast.series.service.GranularityInferencer;
import com.ospicorp.costforecast.series.service.HorizonGenerator;
import com.ospicorp.costforecast.series.service.InsufficientDataException;
import com.ospicorp.costforecast.series.service.SeriesLoader;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the forecasting pipeline over a loaded series: granularity, horizon, each selected
 * forecaster in turn, the optional ensemble, milestone totals and the merged output rows.
 *
 * <p>A forecaster that throws only loses its own column; the run carries on.
 */
@Service
public class ForecastService {

  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

  private final ForecasterRegistry registry;

  public ForecastService(ForecasterRegistry registry) {
    this.registry = registry;
  }

  public ForecastReport forecast(TimeSeries series, ForecastParameters parameters,
      ForecastOptions options) {
    if (series.size() < SeriesLoader.MIN_DATA_POINTS) {
      throw new InsufficientDataException(series.size(), SeriesLoader.MIN_DATA_POINTS);
    }
    Granularity granularity = GranularityInferencer.infer(series);
    Horizon horizon = HorizonGenerator.generate(series.lastDate(), granularity);
    log.info("Forecasting {} {} points from {} to {} over {} steps", series.size(),
        granularity.name().toLowerCase(Locale.ROOT), series.firstDate(), series.lastDate(),
        horizon.size());

    boolean ensemble = options.ensemble() || options.include().contains(Algorithm.ENSEMBLE);
    Map<Algorithm, ForecastResult> results = new EnumMap<>(Algorithm.class);
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (Algorithm algorithm : selection(parameters, options)) {
      ForecastOutcome outcome = run(algorithm, series, horizon, parameters);
      results.put(algorithm, outcome.result());
      diagnostics.addAll(outcome.diagnostics());
    }

    Set<Algorithm> contributors = EnumSet.noneOf(Algorithm.class);
    if (ensemble) {
      contributors.addAll(EnsembleCombiner.contributors(results));
      results.put(Algorithm.ENSEMBLE, EnsembleCombiner.combine(results));
    }

    for (Diagnostic diagnostic : diagnostics) {
      log.warn("[{}] {}: {}", diagnostic.algorithm().column(), diagnostic.kind(),
          diagnostic.message());
    }

    List<MilestoneTotal> milestones = MilestoneAggregator.aggregate(series.lastDate(), horizon,
        results);
    List<ForecastRow> rows = OutputAssembler.assemble(series, horizon, results);
    return new ForecastReport(series, granularity, horizon, results, contributors, milestones,
        diagnostics, rows);
  }

  private List<Algorithm> selection(ForecastParameters parameters, ForecastOptions options) {
    if (options.include().isEmpty()) {
      return registry.defaultSelection(parameters);
    }
    List<Algorithm> selection = new ArrayList<>();
    for (Algorithm algorithm : EnumSet.copyOf(options.include())) {
      if (algorithm == Algorithm.ENSEMBLE) {
        continue;
      }
      if (registry.find(algorithm).isEmpty()) {
        throw new IllegalArgumentException("No forecaster is registered for "
            + algorithm.column());
      }
      selection.add(algorithm);
    }
    return selection;
  }

  private ForecastOutcome run(Algorithm algorithm, TimeSeries series, Horizon horizon,
      ForecastParameters parameters) {
    Forecaster forecaster = registry.find(algorithm).orElseThrow();
    try {
      ForecastOutcome outcome = forecaster.forecast(series, horizon, parameters);
      if (outcome.result().size() != horizon.size()) {
        throw new IllegalStateException(algorithm.column() + " returned "
            + outcome.result().size() + " values for " + horizon.size() + " horizon dates");
      }
      return outcome;
    } catch (RuntimeException ex) {
      log.warn("Forecaster {} failed", algorithm.column(), ex);
      return ForecastOutcome.of(ForecastResult.missing(algorithm, horizon.size()),
          new Diagnostic(algorithm, DiagnosticKind.FORECASTER_FAILED,
              algorithm.column() + " failed: " + ex.getMessage()));
    }
  }
}
