package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import com.ospicorp.tsanalysis.series.model.enums.OutlierMethod;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops rows whose value falls outside the bounds of the chosen method. Columns are filtered one
 * after another, so bounds for a later column are computed over the rows that survived the earlier
 * ones. Rows with a missing value in the column being checked are kept.
 */
public final class OutlierFilter {
  private static final Logger log = LoggerFactory.getLogger(OutlierFilter.class);

  public static final double DEFAULT_THRESHOLD = 1.5;

  private OutlierFilter() {
  }

  public static TimeSeries remove(TimeSeries series, OutlierMethod method, double threshold,
      List<String> columns) {
    if (!Double.isFinite(threshold) || threshold <= 0) {
      throw new TimeSeriesValidationException("outlier threshold must be a positive number");
    }
    if (method == OutlierMethod.PERCENTILE && threshold > 1) {
      throw new TimeSeriesValidationException(
          "percentile threshold is the kept fraction and must be at most 1");
    }
    boolean[] keep = new boolean[series.size()];
    Arrays.fill(keep, true);
    for (String column : series.resolveColumns(columns)) {
      filterColumn(series.column(column), method, threshold, keep);
    }

    List<TimeValue> times = new ArrayList<>();
    Map<String, List<Double>> values = new LinkedHashMap<>();
    series.valueColumns().forEach(c -> values.put(c, new ArrayList<>()));
    for (int i = 0; i < keep.length; i++) {
      if (!keep[i]) {
        continue;
      }
      times.add(series.times().get(i));
      for (String column : series.valueColumns()) {
        values.get(column).add(series.column(column).get(i));
      }
    }
    log.debug("Outlier filter ({}, threshold {}) removed {} of {} rows from {}", method,
        threshold, series.size() - times.size(), series.size(), series.id());
    return series.withData(times, values);
  }

  private static void filterColumn(List<Double> column, OutlierMethod method, double threshold,
      boolean[] keep) {
    List<Double> remaining = new ArrayList<>();
    for (int i = 0; i < keep.length; i++) {
      if (keep[i]) {
        remaining.add(column.get(i));
      }
    }
    double[] present = ColumnStatistics.present(remaining);
    if (present.length == 0) {
      return;
    }
    double lower;
    double upper;
    switch (method) {
      case IQR -> {
        double q1 = ColumnStatistics.quantile(present, 0.25);
        double q3 = ColumnStatistics.quantile(present, 0.75);
        lower = q1 - threshold * (q3 - q1);
        upper = q3 + threshold * (q3 - q1);
      }
      case ZSCORE -> {
        double std = ColumnStatistics.sampleStd(present);
        if (!(std > 0)) {
          return;
        }
        double mean = ColumnStatistics.mean(present);
        lower = mean - threshold * std;
        upper = mean + threshold * std;
      }
      case PERCENTILE -> {
        double tail = (1 - threshold) / 2;
        lower = ColumnStatistics.quantile(present, tail);
        upper = ColumnStatistics.quantile(present, 1 - tail);
      }
      default -> throw new IllegalStateException("unhandled outlier method " + method);
    }
    for (int i = 0; i < keep.length; i++) {
      Double v = column.get(i);
      if (keep[i] && v != null && (v < lower || v > upper)) {
        keep[i] = false;
      }
    }
  }
}
