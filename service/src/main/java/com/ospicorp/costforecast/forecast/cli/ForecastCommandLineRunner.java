package com.ospicorp.costforecast.forecast.cli;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.ospicorp.costforecast.config.ForecastProperties;
import com.ospicorp.costforecast.forecast.controller.CsvHttpMessageConverter;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.service.ForecastOptions;
import com.ospicorp.costforecast.forecast.service.ForecastReport;
import com.ospicorp.costforecast.forecast.service.ForecastService;
import com.ospicorp.costforecast.forecast.service.MilestoneSummaryFormatter;
import com.ospicorp.costforecast.forecast.service.OutputAssembler;
import com.ospicorp.costforecast.series.model.TimeSeries;
import com.ospicorp.costforecast.series.service.InsufficientDataException;
import com.ospicorp.costforecast.series.service.SeriesLoader;
import com.ospicorp.costforecast.series.service.SeriesSchemaException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Batch mode: reads a CSV series from {@code forecast.cli.input} (stdin when unset), writes the
 * merged table as CSV to {@code forecast.cli.output} (stdout when unset) and optionally appends
 * the milestone summary.
 *
 * <p>Exit codes: 0 success, 1 unexpected failure, 2 input or output error, 3 invalid data.
 */
@Component
@Profile("cli")
public class ForecastCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_IO = 2;
  static final int EXIT_INVALID_DATA = 3;

  private static final Logger log = LoggerFactory.getLogger(ForecastCommandLineRunner.class);

  private final ForecastService forecastService;
  private final ForecastParameters parameters;
  private final ForecastProperties.Cli cli;
  private final InputStream stdin;
  private final OutputStream stdout;
  private final CsvMapper csvMapper = new CsvMapper();
  private int exitCode = EXIT_OK;

  @Autowired
  public ForecastCommandLineRunner(ForecastService forecastService, ForecastParameters parameters,
      ForecastProperties properties) {
    this(forecastService, parameters, properties.getCli(), System.in, System.out);
  }

  ForecastCommandLineRunner(ForecastService forecastService, ForecastParameters parameters,
      ForecastProperties.Cli cli, InputStream stdin, OutputStream stdout) {
    this.forecastService = forecastService;
    this.parameters = parameters;
    this.cli = cli;
    this.stdin = stdin;
    this.stdout = stdout;
  }

  @Override
  public void run(String... args) {
    exitCode = execute();
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int execute() {
    TimeSeries series;
    try {
      series = readSeries();
    } catch (IOException ex) {
      log.error("Unable to read input {}: {}", describeInput(), ex.getMessage());
      return EXIT_IO;
    } catch (SeriesSchemaException | InsufficientDataException ex) {
      log.error("Error: {}", ex.getMessage());
      return EXIT_INVALID_DATA;
    }

    ForecastReport report;
    try {
      report = forecastService.forecast(series, parameters,
          ForecastOptions.withEnsemble(cli.isEnsemble()));
    } catch (RuntimeException ex) {
      log.error("Forecast failed", ex);
      return EXIT_FAILURE;
    }

    try {
      write(report);
    } catch (IOException ex) {
      log.error("Unable to write output {}: {}", describeOutput(), ex.getMessage());
      return EXIT_IO;
    }
    log.info("Wrote {} rows with columns {} to {}", report.rows().size(), report.columns(),
        describeOutput());
    return EXIT_OK;
  }

  private void write(ForecastReport report) throws IOException {
    List<Map<String, Object>> table = OutputAssembler.toTable(report.rows(), report.columns(),
        cli.getDateColumn(), cli.getValueColumn());
    if (StringUtils.hasText(cli.getOutput())) {
      try (OutputStream out = Files.newOutputStream(Path.of(cli.getOutput()))) {
        writeTo(out, table, report);
      }
    } else {
      writeTo(stdout, table, report);
    }
  }

  private void writeTo(OutputStream out, List<Map<String, Object>> table, ForecastReport report)
      throws IOException {
    CsvHttpMessageConverter.write(csvMapper, table, out);
    if (cli.isMilestoneSummary()) {
      String summary = "\n" + MilestoneSummaryFormatter.format(report.milestones());
      out.write(summary.getBytes(StandardCharsets.UTF_8));
    }
    out.flush();
  }

  private TimeSeries readSeries() throws IOException {
    if (StringUtils.hasText(cli.getInput())) {
      try (Reader reader = Files.newBufferedReader(Path.of(cli.getInput()),
          StandardCharsets.UTF_8)) {
        return SeriesLoader.fromCsv(reader, cli.getDateColumn(), cli.getValueColumn());
      }
    }
    return SeriesLoader.fromCsv(new InputStreamReader(stdin, StandardCharsets.UTF_8),
        cli.getDateColumn(), cli.getValueColumn());
  }

  private String describeInput() {
    return StringUtils.hasText(cli.getInput()) ? cli.getInput() : "<stdin>";
  }

  private String describeOutput() {
    return StringUtils.hasText(cli.getOutput()) ? cli.getOutput() : "<stdout>";
  }
}
