package com.ospicorp.tsanalysis.series.model.enums;

import java.util.Locale;

public enum NormalizationMethod {
  MINMAX, ZSCORE, ROBUST, LOG;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NormalizationMethod fromCode(String code) {
    if (code == null || code.isBlank()) {
      return MINMAX;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported normalization method '" + code
          + "'. Supported values: minmax,zscore,robust,log.", ex);
    }
  }
}
