package com.ospicorp.tsanalysis.series;

import java.util.NoSuchElementException;

public class TimeSeriesNotFoundException extends NoSuchElementException {
  private final String timeSeriesId;

  public TimeSeriesNotFoundException(String timeSeriesId) {
    super("Time series not found: " + timeSeriesId);
    this.timeSeriesId = timeSeriesId;
  }

  public String timeSeriesId() {
    return timeSeriesId;
  }
}
