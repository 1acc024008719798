package com.ospicorp.costforecast.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.costforecast.TestSeries;
import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.Granularity;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OutputAssemblerTest {

  @Test
  void columnsFollowAlgorithmOrder() {
    var columns = OutputAssembler.columns(
        Set.of(Algorithm.ENSEMBLE, Algorithm.THETA, Algorithm.SMA, Algorithm.ARIMA));

    assertEquals(List.of(Algorithm.SMA, Algorithm.ARIMA, Algorithm.THETA, Algorithm.ENSEMBLE),
        columns);
    assertEquals(List.of(), OutputAssembler.columns(List.of()));
  }

  @Test
  void historyRowsPrecedeForecastRows() {
    var series = TestSeries.daily(LocalDate.of(2024, 1, 1), 1, 2, 3);
    var horizon = new Horizon(Granularity.DAILY,
        List.of(LocalDate.of(2024, 1, 4), LocalDate.of(2024, 1, 5)));
    Map<Algorithm, ForecastResult> results = new EnumMap<>(Algorithm.class);
    results.put(Algorithm.SMA, new ForecastResult(Algorithm.SMA, Arrays.asList(2d, 2d)));
    results.put(Algorithm.ARIMA, new ForecastResult(Algorithm.ARIMA, Arrays.asList(null, 7d)));

    var rows = OutputAssembler.assemble(series, horizon, results);

    assertEquals(5, rows.size());
    assertTrue(rows.get(2).historical());
    assertTrue(rows.get(2).forecasts().isEmpty());
    assertFalse(rows.get(3).historical());
    assertEquals(2d, rows.get(3).forecast(Algorithm.SMA));
    assertNull(rows.get(3).forecast(Algorithm.ARIMA));
    assertEquals(7d, rows.get(4).forecast(Algorithm.ARIMA));
  }

  @Test
  void tableUsesConfiguredColumnNamesAndKeepsMissingCells() {
    var series = TestSeries.daily(LocalDate.of(2024, 1, 1), 5);
    var horizon = new Horizon(Granularity.DAILY, List.of(LocalDate.of(2024, 1, 2)));
    Map<Algorithm, ForecastResult> results = new EnumMap<>(Algorithm.class);
    results.put(Algorithm.ES, new ForecastResult(Algorithm.ES, List.of(4.5)));
    results.put(Algorithm.PROPHET, ForecastResult.missing(Algorithm.PROPHET, 1));
    var rows = OutputAssembler.assemble(series, horizon, results);

    var table = OutputAssembler.toTable(rows, OutputAssembler.columns(results.keySet()), "day",
        "cost");

    assertEquals(List.of("day", "cost", "es", "prophet"), new ArrayList<>(table.get(0).keySet()));
    assertEquals("2024-01-01", table.get(0).get("day"));
    assertEquals(5d, table.get(0).get("cost"));
    assertNull(table.get(0).get("es"));
    assertNull(table.get(1).get("cost"));
    assertEquals(4.5, table.get(1).get("es"));
    assertNull(table.get(1).get("prophet"));
  }
}
