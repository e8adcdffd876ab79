package com.ospicorp.tsanalysis.series.model.enums;

import java.util.Locale;

public enum ExportFormat {
  CSV("text/csv", "csv"),
  JSON("application/json", "json");

  private final String mediaType;
  private final String extension;

  ExportFormat(String mediaType, String extension) {
    this.mediaType = mediaType;
    this.extension = extension;
  }

  public String mediaType() {
    return mediaType;
  }

  public String extension() {
    return extension;
  }

  public static ExportFormat fromCode(String code) {
    if (code == null || code.isBlank()) {
      return CSV;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported export format: " + code, ex);
    }
  }
}
