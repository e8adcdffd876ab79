package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.enums.Aggregation;
import com.ospicorp.tsanalysis.series.model.enums.FillPolicy;
import com.ospicorp.tsanalysis.series.model.enums.NormalizationMethod;
import com.ospicorp.tsanalysis.series.model.enums.OutlierMethod;
import com.ospicorp.tsanalysis.series.model.enums.ResampleFrequency;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TimeSeriesPreprocessor {
  private static final Logger log = LoggerFactory.getLogger(TimeSeriesPreprocessor.class);

  private TimeSeriesPreprocessor() {
  }

  public static TimeSeries process(TimeSeries series, List<? extends PreprocessingStep> steps) {
    TimeSeries current = series;
    for (PreprocessingStep step : steps == null ? List.<PreprocessingStep>of() : steps) {
      current = step.apply(current);
      log.debug("Applied {} to {}: {} rows", step, series.id(), current.size());
    }
    return current;
  }

  /**
   * Builds a step from its wire form: {@code type} is one of missing_values, outliers, normalize
   * or resample and {@code params} carries method, columns, limit, value, threshold, freq and
   * agg_func as the type needs them.
   */
  public static PreprocessingStep parseStep(String type, Map<String, ?> params) {
    Map<String, ?> p = params == null ? Map.of() : params;
    if (type == null) {
      throw new TimeSeriesValidationException("preprocessing step type must be provided");
    }
    return switch (type.trim()) {
      case "missing_values" -> new PreprocessingStep.FillMissing(
          FillPolicy.fromCode(text(p, "method", "ffill")), columns(p),
          integer(p, "limit"), number(p, "value"));
      case "outliers" -> {
        Double threshold = number(p, "threshold");
        yield new PreprocessingStep.RemoveOutliers(
            OutlierMethod.fromCode(text(p, "method", null)),
            threshold == null ? OutlierFilter.DEFAULT_THRESHOLD : threshold, columns(p));
      }
      case "normalize" -> new PreprocessingStep.Normalize(
          NormalizationMethod.fromCode(text(p, "method", null)), columns(p));
      case "resample" -> new PreprocessingStep.Resample(
          ResampleFrequency.fromCode(text(p, "freq", null)),
          Aggregation.fromCode(text(p, "agg_func", null)));
      default -> throw new TimeSeriesValidationException("Unsupported preprocessing step '" + type
          + "'. Supported values: missing_values,outliers,normalize,resample.");
    };
  }

  private static String text(Map<String, ?> params, String key, String fallback) {
    Object value = params.get(key);
    return value == null ? fallback : value.toString();
  }

  private static Double number(Map<String, ?> params, String key) {
    Object value = params.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    try {
      return Double.valueOf(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new TimeSeriesValidationException("'" + key + "' must be a number, got '" + value
          + "'");
    }
  }

  private static Integer integer(Map<String, ?> params, String key) {
    Double value = number(params, key);
    if (value == null) {
      return null;
    }
    if (value != Math.rint(value)) {
      throw new TimeSeriesValidationException("'" + key + "' must be a whole number");
    }
    return value.intValue();
  }

  private static List<String> columns(Map<String, ?> params) {
    Object value = params.get("columns");
    if (value == null) {
      return null;
    }
    if (!(value instanceof List<?> list)) {
      throw new TimeSeriesValidationException("'columns' must be a list of column names");
    }
    List<String> columns = new ArrayList<>(list.size());
    list.forEach(c -> columns.add(String.valueOf(c)));
    return columns;
  }
}
