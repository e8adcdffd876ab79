package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import com.ospicorp.tsanalysis.series.model.RawTable;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public final class TimeSeriesFactory {
  private static final Set<String> MISSING_MARKERS = Set.of("", "nan", "na", "n/a", "null");

  private TimeSeriesFactory() {
  }

  public static TimeSeries create(RawTable table, String timeColumn, List<String> valueColumns) {
    return create(table, timeColumn, valueColumns, null, null);
  }

  public static TimeSeries create(RawTable table, String timeColumn, List<String> valueColumns,
      String name, String description) {
    if (table == null || table.columns().isEmpty()) {
      throw new TimeSeriesValidationException("input has no columns");
    }
    List<String> columns = table.columns();
    Map<String, Integer> positions = new HashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      String column = columns.get(i);
      if (column == null || column.isBlank()) {
        throw new TimeSeriesValidationException("column " + (i + 1) + " has no name");
      }
      if (positions.putIfAbsent(column, i) != null) {
        throw new TimeSeriesValidationException("duplicate column '" + column + "'");
      }
    }

    String effectiveTimeColumn = timeColumn != null ? timeColumn : columns.get(0);
    if (!positions.containsKey(effectiveTimeColumn)) {
      throw new TimeSeriesValidationException("time column '" + effectiveTimeColumn
          + "' not found. Available columns: " + columns);
    }
    List<String> effectiveValueColumns = valueColumns != null
        ? valueColumns
        : columns.stream().filter(c -> !c.equals(effectiveTimeColumn)).toList();
    if (effectiveValueColumns.isEmpty()) {
      throw new TimeSeriesValidationException("at least one value column is required");
    }
    for (String column : effectiveValueColumns) {
      if (column != null && !column.equals(effectiveTimeColumn)
          && !positions.containsKey(column)) {
        throw new TimeSeriesValidationException("value column '" + column
            + "' not found. Available columns: " + columns);
      }
    }

    int timeIndex = positions.get(effectiveTimeColumn);
    List<TimeValue> times = new ArrayList<>(table.rows().size());
    Map<String, List<Double>> values = new LinkedHashMap<>();
    for (String column : effectiveValueColumns) {
      values.putIfAbsent(column, new ArrayList<>(table.rows().size()));
    }
    Set<TimeValue> seenTimes = new HashSet<>();

    for (int r = 0; r < table.rows().size(); r++) {
      List<Object> row = table.rows().get(r);
      int line = r + 1;
      if (row.size() != columns.size()) {
        throw new TimeSeriesValidationException("row " + line + " has " + row.size()
            + " cells, expected " + columns.size());
      }
      TimeValue time = parseTime(row.get(timeIndex), line);
      if (!seenTimes.add(time)) {
        throw new TimeSeriesValidationException("row " + line + " repeats time value '"
            + time.render() + "'");
      }
      times.add(time);
      for (String column : effectiveValueColumns) {
        Integer position = positions.get(column);
        if (position != null && position != timeIndex) {
          values.get(column).add(parseValue(row.get(position), column, line));
        }
      }
    }

    // remaining column checks (time column overlap, duplicates) happen in the entity itself
    return new TimeSeries(UUID.randomUUID().toString(), name, description, effectiveTimeColumn,
        effectiveValueColumns, times, values, null, null);
  }

  static TimeValue parseTime(Object cell, int line) {
    if (cell == null || cell.toString().isBlank()) {
      throw new TimeSeriesValidationException("row " + line + " has no time value");
    }
    try {
      return TimeValue.of(cell);
    } catch (IllegalArgumentException ex) {
      throw new TimeSeriesValidationException("row " + line + ": " + ex.getMessage());
    }
  }

  static Double parseValue(Object cell, String column, int line) {
    if (cell == null) {
      return null;
    }
    if (cell instanceof Number number) {
      double v = number.doubleValue();
      return Double.isFinite(v) ? v : null;
    }
    String text = cell.toString().trim();
    if (MISSING_MARKERS.contains(text.toLowerCase(Locale.ROOT))) {
      return null;
    }
    try {
      double v = Double.parseDouble(text);
      return Double.isFinite(v) ? v : null;
    } catch (NumberFormatException ex) {
      throw new TimeSeriesValidationException("row " + line + ", column '" + column
          + "': '" + text + "' is not a number");
    }
  }
}
