package com.ospicorp.tsanalysis.series.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public record RawTable(List<String> columns, List<List<Object>> rows) {

  public RawTable {
    columns = columns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(columns));
    List<List<Object>> copy = new ArrayList<>();
    if (rows != null) {
      for (List<Object> row : rows) {
        copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
      }
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static RawTable of(List<String> columns, Object[]... rows) {
    List<List<Object>> converted = new ArrayList<>(rows.length);
    for (Object[] row : rows) {
      converted.add(Arrays.asList(row));
    }
    return new RawTable(columns, converted);
  }
}
