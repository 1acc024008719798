package com.ospicorp.costforecast.forecast.service;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastResult;
import com.ospicorp.costforecast.forecast.model.Horizon;
import com.ospicorp.costforecast.series.model.DataPoint;
import com.ospicorp.costforecast.series.model.TimeSeries;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class OutputAssembler {

  private OutputAssembler() {
  }

  /** Output columns for {@code algorithms}, in table order. */
  public static List<Algorithm> columns(Collection<Algorithm> algorithms) {
    return algorithms.isEmpty() ? List.of() : List.copyOf(EnumSet.copyOf(algorithms));
  }

  public static List<ForecastRow> assemble(TimeSeries series, Horizon horizon,
      Map<Algorithm, ForecastResult> results) {
    List<ForecastRow> rows = new ArrayList<>(series.size() + horizon.size());
    for (DataPoint point : series.points()) {
      rows.add(new ForecastRow(point.date(), point.value(), Map.of()));
    }
    for (int i = 0; i < horizon.size(); i++) {
      Map<Algorithm, Double> forecasts = new HashMap<>();
      for (Map.Entry<Algorithm, ForecastResult> entry : results.entrySet()) {
        ForecastResult result = entry.getValue();
        if (i < result.size() && result.value(i) != null) {
          forecasts.put(entry.getKey(), result.value(i));
        }
      }
      rows.add(new ForecastRow(horizon.date(i), null, forecasts));
    }
    return rows;
  }

  /**
   * Flattens rows into ordered maps keyed by column name, ready for CSV or JSON rendering.
   * Missing values stay {@code null} and render as empty CSV cells.
   */
  public static List<Map<String, Object>> toTable(List<ForecastRow> rows, List<Algorithm> columns,
      String dateColumn, String valueColumn) {
    List<Map<String, Object>> table = new ArrayList<>(rows.size());
    for (ForecastRow row : rows) {
      Map<String, Object> line = new LinkedHashMap<>();
      line.put(dateColumn, row.date().toString());
      line.put(valueColumn, row.actual());
      for (Algorithm column : columns) {
        line.put(column.column(), row.forecast(column));
      }
      table.add(line);
    }
    return table;
  }
}
