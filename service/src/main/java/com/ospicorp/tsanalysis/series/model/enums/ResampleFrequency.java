package com.ospicorp.tsanalysis.series.model.enums;

public enum ResampleFrequency {
  MINUTE("min"),
  HOUR("H"),
  DAY("D"),
  WEEK("W"),
  MONTH("M"),
  QUARTER("Q"),
  YEAR("A");

  private final String code;

  ResampleFrequency(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static ResampleFrequency fromCode(String code) {
    if (code == null || code.isBlank()) {
      return DAY;
    }
    String wanted = code.trim();
    for (ResampleFrequency frequency : values()) {
      if (frequency.code.equalsIgnoreCase(wanted)) {
        return frequency;
      }
    }
    throw new IllegalArgumentException("Unsupported frequency '" + code
        + "'. Supported values: min,H,D,W,M,Q,A.");
  }
}
