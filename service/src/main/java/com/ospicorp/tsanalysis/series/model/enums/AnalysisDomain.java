package com.ospicorp.tsanalysis.series.model.enums;

import java.util.Locale;

public enum AnalysisDomain {
  TIME, FREQUENCY;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AnalysisDomain fromCode(String code) {
    if (code == null || code.isBlank()) {
      return TIME;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported domain '" + code
          + "'. Supported values: time,frequency.", ex);
    }
  }
}
