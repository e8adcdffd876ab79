package com.ospicorp.tsanalysis.series.model.enums;

import java.util.Locale;

public enum Aggregation {
  MEAN, SUM, MEDIAN, MIN, MAX;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Aggregation fromCode(String code) {
    if (code == null || code.isBlank()) {
      return MEAN;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported aggregation '" + code
          + "'. Supported values: mean,sum,median,min,max.", ex);
    }
  }
}
