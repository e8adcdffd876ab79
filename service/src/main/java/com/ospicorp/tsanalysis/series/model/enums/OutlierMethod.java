package com.ospicorp.tsanalysis.series.model.enums;

import java.util.Locale;

public enum OutlierMethod {
  IQR, ZSCORE, PERCENTILE;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static OutlierMethod fromCode(String code) {
    if (code == null || code.isBlank()) {
      return IQR;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported outlier method '" + code
          + "'. Supported values: iqr,zscore,percentile.", ex);
    }
  }
}
