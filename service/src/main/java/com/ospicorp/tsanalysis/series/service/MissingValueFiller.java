package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.enums.FillPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MissingValueFiller {
  private MissingValueFiller() {
  }

  public static TimeSeries fill(TimeSeries series, FillPolicy policy) {
    return fill(series, policy, null, null, null);
  }

  public static TimeSeries fill(TimeSeries series, FillPolicy policy, List<String> columns,
      Integer limit, Double constant) {
    if (policy == null || policy == FillPolicy.NONE) {
      return series;
    }
    List<String> targets = series.resolveColumns(columns);
    Map<String, List<Double>> filled = new LinkedHashMap<>(series.values());
    for (String column : targets) {
      filled.put(column, fill(series.column(column), policy, limit, constant));
    }
    return series.withValues(filled);
  }

  public static List<Double> fill(List<Double> in, FillPolicy policy) {
    return fill(in, policy, null, null);
  }

  public static List<Double> fill(List<Double> in, FillPolicy policy, Integer limit,
      Double constant) {
    if (policy == null || policy == FillPolicy.NONE) {
      return in;
    }
    if (limit != null && limit <= 0) {
      throw new TimeSeriesValidationException("fill limit must be greater than 0");
    }
    List<Double> out = new ArrayList<>(in);
    double[] present = ColumnStatistics.present(in);
    switch (policy) {
      case FFILL -> forwardFill(out, limit);
      case BFILL -> {
        Collections.reverse(out);
        forwardFill(out, limit);
        Collections.reverse(out);
      }
      case MEAN -> replaceMissing(out, present.length == 0 ? null : ColumnStatistics.mean(present));
      case MEDIAN -> replaceMissing(out,
          present.length == 0 ? null : ColumnStatistics.median(present));
      case MODE -> replaceMissing(out, present.length == 0 ? null : ColumnStatistics.mode(present));
      case CONSTANT -> {
        if (constant == null || !Double.isFinite(constant)) {
          throw new TimeSeriesValidationException("constant fill needs a finite value");
        }
        replaceMissing(out, constant);
      }
      default -> {
        return in;
      }
    }
    return out;
  }

  private static void forwardFill(List<Double> values, Integer limit) {
    Double last = null;
    int gap = 0;
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) != null) {
        last = values.get(i);
        gap = 0;
        continue;
      }
      gap++;
      if (last != null && (limit == null || gap <= limit)) {
        values.set(i, last);
      }
    }
  }

  private static void replaceMissing(List<Double> values, Double replacement) {
    if (replacement == null) {
      return;
    }
    values.replaceAll(v -> v == null ? replacement : v);
  }
}
