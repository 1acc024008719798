package com.ospicorp.costforecast.series.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.costforecast.series.model.DataPoint;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw two-column input into a {@link TimeSeries}: unparsable dates and non-numeric or
 * non-finite values are dropped, rows are sorted by date and duplicate dates keep the last row.
 */
public final class SeriesLoader {

  public static final int MIN_DATA_POINTS = 10;

  private static final Logger log = LoggerFactory.getLogger(SeriesLoader.class);
  private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
      LocalDate::parse,
      value -> LocalDateTime.parse(value.replace(' ', 'T')).toLocalDate(),
      value -> OffsetDateTime.parse(value.replace(' ', 'T')).toLocalDate());
  private static final CsvMapper CSV_MAPPER = new CsvMapper()
      .enable(CsvParser.Feature.WRAP_AS_ARRAY);

  private SeriesLoader() {
  }

  public static TimeSeries fromCsv(Reader reader, String dateColumn, String valueColumn) {
    if (dateColumn == null || dateColumn.isBlank()
        || valueColumn == null || valueColumn.isBlank()) {
      throw new SeriesSchemaException("date and value column names must be provided");
    }
    List<RawRow> rows = new ArrayList<>();
    try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class).readValues(reader)) {
      if (!it.hasNext()) {
        throw new SeriesSchemaException("Input data is empty.");
      }
      String[] header = it.next();
      int dateIndex = indexOf(header, dateColumn);
      int valueIndex = indexOf(header, valueColumn);
      List<String> missing = new ArrayList<>();
      if (dateIndex < 0) {
        missing.add(dateColumn);
      }
      if (valueIndex < 0) {
        missing.add(valueColumn);
      }
      if (!missing.isEmpty()) {
        throw new SeriesSchemaException("Missing required columns: " + String.join(", ", missing));
      }
      while (it.hasNext()) {
        String[] row = it.next();
        rows.add(new RawRow(cell(row, dateIndex), cell(row, valueIndex)));
      }
    } catch (IOException | RuntimeJsonMappingException ex) {
      throw new SeriesSchemaException("Failed to parse input data: " + ex.getMessage(), ex);
    }
    if (rows.isEmpty()) {
      throw new SeriesSchemaException("Input data is empty.");
    }

    List<DataPoint> points = new ArrayList<>(rows.size());
    for (RawRow row : rows) {
      points.add(new DataPoint(parseDate(row.date()), parseValue(row.value())));
    }
    return fromPoints(points);
  }

  /** Cleans points that may carry missing dates, missing values or non-finite values. */
  public static TimeSeries fromPoints(List<DataPoint> raw) {
    Map<LocalDate, Double> byDate = new TreeMap<>(Comparator.naturalOrder());
    int dropped = 0;
    for (DataPoint point : raw) {
      if (point == null || point.date() == null || point.value() == null
          || !Double.isFinite(point.value())) {
        dropped++;
        continue;
      }
      byDate.put(point.date(), point.value());
    }
    int duplicates = raw.size() - dropped - byDate.size();
    if (byDate.size() < MIN_DATA_POINTS) {
      log.warn("Rejecting series with {} valid points ({} dropped, minimum {})",
          byDate.size(), dropped, MIN_DATA_POINTS);
      throw new InsufficientDataException(byDate.size(), MIN_DATA_POINTS);
    }
    List<DataPoint> cleaned = new ArrayList<>(byDate.size());
    byDate.forEach((date, value) -> cleaned.add(new DataPoint(date, value)));
    log.debug("Loaded series with {} points ({} dropped, {} duplicate dates collapsed)",
        cleaned.size(), dropped, duplicates);
    return TimeSeries.of(cleaned);
  }

  public static LocalDate parseDate(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    String value = text.trim();
    DateTimeParseException failure = null;
    for (Function<String, LocalDate> parser : DATE_PARSERS) {
      try {
        return parser.apply(value);
      } catch (DateTimeParseException ex) {
        failure = ex;
      }
    }
    log.debug("Dropping row with unparsable date '{}': {}", value, failure.getMessage());
    return null;
  }

  static Double parseValue(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      double value = Double.parseDouble(text.trim());
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static int indexOf(String[] header, String column) {
    for (int i = 0; i < header.length; i++) {
      String name = header[i] == null ? "" : header[i].replace("\uFEFF", "").trim();
      if (name.equals(column.trim())) {
        return i;
      }
    }
    return -1;
  }

  private static String cell(String[] row, int index) {
    return index < row.length ? row[index] : null;
  }

  private record RawRow(String date, String value) {}
}
