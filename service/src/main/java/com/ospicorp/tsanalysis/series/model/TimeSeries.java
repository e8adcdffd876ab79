package com.ospicorp.tsanalysis.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeSeries(
    String id,
    String name,
    String description,
    @JsonProperty("time_column") String timeColumn,
    @JsonProperty("value_columns") List<String> valueColumns,
    List<TimeValue> times,
    Map<String, List<Double>> values,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

  public TimeSeries {
    if (timeColumn == null || timeColumn.isBlank()) {
      throw new TimeSeriesValidationException("time column must be provided");
    }
    if (valueColumns == null || valueColumns.isEmpty()) {
      throw new TimeSeriesValidationException("at least one value column is required");
    }
    Set<String> seen = new HashSet<>();
    for (String column : valueColumns) {
      if (column == null || column.isBlank()) {
        throw new TimeSeriesValidationException("value column names must not be blank");
      }
      if (column.equals(timeColumn)) {
        throw new TimeSeriesValidationException(
            "value columns must not include the time column '" + timeColumn + "'");
      }
      if (!seen.add(column)) {
        throw new TimeSeriesValidationException("duplicate value column '" + column + "'");
      }
    }
    times = times == null ? List.of() : List.copyOf(times);
    Map<String, List<Double>> copy = new LinkedHashMap<>();
    for (String column : valueColumns) {
      List<Double> columnValues = values == null ? null : values.get(column);
      if (columnValues == null) {
        throw new TimeSeriesValidationException("missing values for column '" + column + "'");
      }
      if (columnValues.size() != times.size()) {
        throw new TimeSeriesValidationException("column '" + column + "' has "
            + columnValues.size() + " values but the time column has " + times.size());
      }
      copy.put(column, Collections.unmodifiableList(new ArrayList<>(columnValues)));
    }
    if (values != null && values.size() != copy.size()) {
      throw new TimeSeriesValidationException(
          "values present for columns outside " + valueColumns);
    }
    valueColumns = List.copyOf(valueColumns);
    values = Collections.unmodifiableMap(copy);
  }

  public int size() {
    return times.size();
  }

  public List<Double> column(String column) {
    List<Double> columnValues = values.get(column);
    if (columnValues == null) {
      throw new IllegalArgumentException("unknown value column '" + column + "'");
    }
    return columnValues;
  }

  public List<String> columns() {
    List<String> columns = new ArrayList<>(valueColumns.size() + 1);
    columns.add(timeColumn);
    columns.addAll(valueColumns);
    return columns;
  }

  public TimeSeries withId(String newId) {
    return new TimeSeries(newId, name, description, timeColumn, valueColumns, times, values,
        createdAt, updatedAt);
  }

  public TimeSeries withTimestamps(Instant created, Instant updated) {
    return new TimeSeries(id, name, description, timeColumn, valueColumns, times, values,
        created, updated);
  }

  public TimeSeries withValues(Map<String, List<Double>> newValues) {
    return new TimeSeries(id, name, description, timeColumn, valueColumns, times, newValues,
        createdAt, updatedAt);
  }

  public TimeSeries withData(List<TimeValue> newTimes, Map<String, List<Double>> newValues) {
    return new TimeSeries(id, name, description, timeColumn, valueColumns, newTimes, newValues,
        createdAt, updatedAt);
  }

  public List<String> resolveColumns(List<String> requested) {
    if (requested == null || requested.isEmpty()) {
      return valueColumns;
    }
    for (String column : requested) {
      if (!values.containsKey(column)) {
        throw new TimeSeriesValidationException("unknown value column '" + column
            + "'; value columns are " + valueColumns);
      }
    }
    return List.copyOf(requested);
  }

  public boolean hasSameData(TimeSeries other) {
    return other != null
        && timeColumn.equals(other.timeColumn)
        && valueColumns.equals(other.valueColumns)
        && times.equals(other.times)
        && Objects.equals(values, other.values);
  }
}
