package com.ospicorp.costforecast.forecast.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

@Schema(description = "Historical series plus run options")
public record ForecastRequest(
    @JsonProperty("points") @NotNull @Schema(description = "Observations; order does not matter")
    List<PointInput> points,
    @JsonProperty("parameters") @Valid ParameterOverrides parameters,
    @JsonProperty("ensemble") @Schema(description = "Add the ensemble column", example = "true")
    Boolean ensemble,
    @JsonProperty("include") @Schema(description = "Algorithms to run instead of the default set",
        example = "[\"sma\", \"hw\", \"theta\"]")
    List<String> include,
    @JsonProperty("date_column") @Schema(description = "Date column name in tabular output",
        example = "date")
    String dateColumn,
    @JsonProperty("value_column") @Schema(description = "Value column name in tabular output",
        example = "cost")
    String valueColumn
) {

  /** One observation. Dates accept {@code yyyy-MM-dd} or ISO timestamps. */
  public record PointInput(
      @JsonProperty("date") @Schema(example = "2024-01-31") String date,
      @JsonProperty("value") @Schema(example = "1234.5") Double value
  ) {
  }
}
