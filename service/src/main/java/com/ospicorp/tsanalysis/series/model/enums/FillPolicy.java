package com.ospicorp.tsanalysis.series.model.enums;

import java.util.Locale;

public enum FillPolicy {
  NONE, FFILL, BFILL, MEAN, MEDIAN, MODE, CONSTANT;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static FillPolicy fromCode(String code) {
    if (code == null || code.isBlank()) {
      return NONE;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported fill method '" + code
          + "'. Supported values: none,ffill,bfill,mean,median,mode,constant.", ex);
    }
  }
}
