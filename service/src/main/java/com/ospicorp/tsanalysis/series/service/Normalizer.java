package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.enums.NormalizationMethod;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

public final class Normalizer {
  private Normalizer() {
  }

  public static TimeSeries normalize(TimeSeries series, NormalizationMethod method,
      List<String> columns) {
    Map<String, List<Double>> scaled = new LinkedHashMap<>(series.values());
    for (String column : series.resolveColumns(columns)) {
      scaled.put(column, normalize(series.column(column), method));
    }
    return series.withValues(scaled);
  }

  public static List<Double> normalize(List<Double> in, NormalizationMethod method) {
    double[] present = ColumnStatistics.present(in);
    if (present.length == 0) {
      return in;
    }
    DoubleUnaryOperator scale = scaler(present, method);
    if (scale == null) {
      return in;
    }
    List<Double> out = new ArrayList<>(in.size());
    for (Double v : in) {
      out.add(v == null ? null : scale.applyAsDouble(v));
    }
    return out;
  }

  // null when the column has no spread to scale by
  private static DoubleUnaryOperator scaler(double[] present, NormalizationMethod method) {
    switch (method) {
      case MINMAX -> {
        return minMax(present);
      }
      case ZSCORE -> {
        double std = ColumnStatistics.sampleStd(present);
        double mean = ColumnStatistics.mean(present);
        return std > 0 ? v -> (v - mean) / std : null;
      }
      case ROBUST -> {
        double iqr = ColumnStatistics.quantile(present, 0.75)
            - ColumnStatistics.quantile(present, 0.25);
        double median = ColumnStatistics.median(present);
        return iqr > 0 ? v -> (v - median) / iqr : null;
      }
      case LOG -> {
        double min = ColumnStatistics.min(present);
        // shift so the smallest value maps to log(1)
        double offset = min <= 0 ? Math.abs(min) + 1 : 0;
        return v -> Math.log(v + offset);
      }
      default -> throw new IllegalStateException("unhandled normalization method " + method);
    }
  }

  private static DoubleUnaryOperator minMax(double[] present) {
    double min = ColumnStatistics.min(present);
    double max = ColumnStatistics.max(present);
    if (max > min) {
      return v -> (v - min) / (max - min);
    }
    double flat = min == 0 ? 0 : 0.5;
    return v -> flat;
  }
}
