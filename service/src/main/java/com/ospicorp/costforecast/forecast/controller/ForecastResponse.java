package com.ospicorp.costforecast.forecast.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.Diagnostic;
import com.ospicorp.costforecast.forecast.model.MilestoneTotal;
import com.ospicorp.costforecast.forecast.service.ForecastReport;
import com.ospicorp.costforecast.forecast.service.OutputAssembler;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResponse(
    @JsonProperty("granularity") String granularity,
    @JsonProperty("history") History history,
    @JsonProperty("horizon") HorizonSummary horizon,
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("ensemble_contributors") List<String> ensembleContributors,
    @JsonProperty("milestones") List<MilestoneEntry> milestones,
    @JsonProperty("diagnostics") List<DiagnosticEntry> diagnostics,
    @JsonProperty("rows") List<Map<String, Object>> rows
) {

  public record History(
      @JsonProperty("first_date") LocalDate firstDate,
      @JsonProperty("last_date") LocalDate lastDate,
      @JsonProperty("points") int points
  ) {
  }

  public record HorizonSummary(
      @JsonProperty("start") LocalDate start,
      @JsonProperty("end") LocalDate end,
      @JsonProperty("steps") int steps
  ) {
  }

  public record MilestoneEntry(
      @JsonProperty("milestone") String milestone,
      @JsonProperty("date") LocalDate date,
      @JsonProperty("totals") Map<String, Double> totals
  ) {
  }

  public record DiagnosticEntry(
      @JsonProperty("algorithm") String algorithm,
      @JsonProperty("kind") String kind,
      @JsonProperty("message") String message
  ) {
  }

  static ForecastResponse from(ForecastReport report, String dateColumn, String valueColumn) {
    List<String> columns = new ArrayList<>();
    for (Algorithm algorithm : report.columns()) {
      columns.add(algorithm.column());
    }

    List<String> contributors = null;
    if (report.results().containsKey(Algorithm.ENSEMBLE)) {
      contributors = new ArrayList<>();
      for (Algorithm algorithm : OutputAssembler.columns(report.ensembleContributors())) {
        contributors.add(algorithm.column());
      }
    }

    List<MilestoneEntry> milestones = new ArrayList<>();
    for (MilestoneTotal total : report.milestones()) {
      Map<String, Double> totals = new LinkedHashMap<>();
      total.totals().forEach((algorithm, sum) -> totals.put(algorithm.column(), sum));
      milestones.add(new MilestoneEntry(total.milestone().label(), total.date(), totals));
    }

    List<DiagnosticEntry> diagnostics = new ArrayList<>();
    for (Diagnostic diagnostic : report.diagnostics()) {
      diagnostics.add(new DiagnosticEntry(diagnostic.algorithm().column(),
          diagnostic.kind().name().toLowerCase(Locale.ROOT), diagnostic.message()));
    }

    return new ForecastResponse(
        report.granularity().name().toLowerCase(Locale.ROOT),
        new History(report.series().firstDate(), report.series().lastDate(),
            report.series().size()),
        new HorizonSummary(report.horizon().date(0),
            report.horizon().date(report.horizon().size() - 1), report.horizon().size()),
        columns,
        contributors,
        milestones,
        diagnostics,
        OutputAssembler.toTable(report.rows(), report.columns(), dateColumn, valueColumn));
  }
}
