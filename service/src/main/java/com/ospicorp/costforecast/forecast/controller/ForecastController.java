package com.ospicorp.costforecast.forecast.controller;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.service.ForecastOptions;
import com.ospicorp.costforecast.forecast.service.ForecastReport;
import com.ospicorp.costforecast.forecast.service.ForecastService;
import com.ospicorp.costforecast.forecast.service.ForecasterRegistry;
import com.ospicorp.costforecast.forecast.service.OutputAssembler;
import com.ospicorp.costforecast.series.model.DataPoint;
import com.ospicorp.costforecast.series.model.TimeSeries;
import com.ospicorp.costforecast.series.service.SeriesLoader;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/forecasts")
@Validated
@Tag(name = "Forecasts")
public class ForecastController {

  static final int INVALID_ALGORITHM = 2009;
  static final int INVALID_FORMAT = 2010;
  static final int INVALID_COLUMN = 2011;

  private static final String DEFAULT_DATE_COLUMN = "date";
  private static final String DEFAULT_VALUE_COLUMN = "value";

  private final ForecastService forecastService;
  private final ForecasterRegistry registry;
  private final ForecastParameters defaults;

  public ForecastController(ForecastService forecastService, ForecasterRegistry registry,
      ForecastParameters defaults) {
    this.forecastService = forecastService;
    this.registry = registry;
    this.defaults = defaults;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Forecast a JSON series",
      description = "Runs every selected method over the series and returns the merged table,"
          + " milestone totals and per-method diagnostics.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Not enough valid observations",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> forecast(@Valid @RequestBody ForecastRequest request,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "Response format, json or csv") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    ForecastParameters parameters = request.parameters() == null
        ? defaults : request.parameters().applyTo(defaults);
    ForecastOptions options = new ForecastOptions(Boolean.TRUE.equals(request.ensemble()),
        parseAlgorithms(request.include()));

    List<DataPoint> points = new ArrayList<>(request.points().size());
    for (ForecastRequest.PointInput point : request.points()) {
      if (point != null) {
        points.add(new DataPoint(SeriesLoader.parseDate(point.date()), point.value()));
      }
    }
    TimeSeries series = SeriesLoader.fromPoints(points);
    ForecastReport report = forecastService.forecast(series, parameters, options);
    return respond(report, contentType,
        columnName(request.dateColumn(), DEFAULT_DATE_COLUMN),
        columnName(request.valueColumn(), DEFAULT_VALUE_COLUMN));
  }

  @PostMapping(path = "/csv", consumes = "text/csv")
  @Operation(summary = "Forecast a CSV upload",
      description = "Reads the date and value columns of a CSV body; rows with unparsable dates or"
          + " non-numeric values are dropped. Algorithm parameters come from configuration.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Missing columns or unreadable CSV",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Not enough valid observations",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> forecastCsv(@RequestBody String body,
      @RequestParam(name = "date_column", defaultValue = DEFAULT_DATE_COLUMN)
      @Parameter(description = "Name of the date column", example = "date") String dateColumn,
      @RequestParam(name = "value_column", defaultValue = DEFAULT_VALUE_COLUMN)
      @Parameter(description = "Name of the value column", example = "cost") String valueColumn,
      @RequestParam(name = "ensemble", defaultValue = "false")
      @Parameter(description = "Add the ensemble column") boolean ensemble,
      @RequestParam(name = "include", required = false)
      @Parameter(description = "Comma separated algorithms to run", example = "sma,es,hw")
      String include,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "Response format, json or csv") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    String dates = columnName(dateColumn, null);
    String values = columnName(valueColumn, null);
    List<String> requested = StringUtils.hasText(include)
        ? List.of(include.split(",")) : List.of();
    ForecastOptions options = new ForecastOptions(ensemble, parseAlgorithms(requested));

    TimeSeries series = SeriesLoader.fromCsv(new StringReader(body), dates, values);
    ForecastReport report = forecastService.forecast(series, defaults, options);
    return respond(report, contentType, dates, values);
  }

  @GetMapping("/algorithms")
  @Operation(summary = "List forecasting methods",
      description = "Every method with its enabled flag under the current configuration.")
  @ApiResponse(responseCode = "200", description = "Algorithm catalogue",
      content = @Content(mediaType = "application/json",
          array = @ArraySchema(schema = @Schema(implementation = AlgorithmInfo.class))))
  public List<AlgorithmInfo> algorithms() {
    Set<Algorithm> byDefault = Set.copyOf(registry.defaultSelection(defaults));
    List<AlgorithmInfo> catalogue = new ArrayList<>();
    for (Algorithm algorithm : OutputAssembler.columns(registry.available())) {
      catalogue.add(new AlgorithmInfo(algorithm.column(), algorithm.external(),
          defaults.isEnabled(algorithm), byDefault.contains(algorithm)));
    }
    catalogue.add(new AlgorithmInfo(Algorithm.ENSEMBLE.column(), false, true, false));
    return catalogue;
  }

  private ResponseEntity<?> respond(ForecastReport report, MediaType contentType,
      String dateColumn, String valueColumn) {
    if (CsvHttpMessageConverter.TEXT_CSV.equals(contentType)) {
      return ResponseEntity.ok()
          .contentType(contentType)
          .body(OutputAssembler.toTable(report.rows(), report.columns(), dateColumn, valueColumn));
    }
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(ForecastResponse.from(report, dateColumn, valueColumn));
  }

  private static List<Algorithm> parseAlgorithms(List<String> names) {
    if (names == null) {
      return List.of();
    }
    List<Algorithm> algorithms = new ArrayList<>();
    for (String name : names) {
      if (!StringUtils.hasText(name)) {
        continue;
      }
      try {
        algorithms.add(Algorithm.fromColumn(name));
      } catch (IllegalArgumentException ex) {
        throw InvalidParameterException.of("Invalid algorithm '" + name.trim()
            + "'. Supported values: sma,es,hw,arima,sarima,theta,prophet,neural_prophet,darts,"
            + "ensemble.", INVALID_ALGORITHM);
      }
    }
    return algorithms;
  }

  private static String columnName(String value, String fallback) {
    if (!StringUtils.hasText(value)) {
      if (fallback == null) {
        throw InvalidParameterException.of("Column names must not be blank.", INVALID_COLUMN);
      }
      return fallback;
    }
    return value.trim();
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw InvalidParameterException.of("Invalid format value. Supported values: json,csv.",
          INVALID_FORMAT);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
