package com.ospicorp.tsanalysis.series;

public class TimeSeriesValidationException extends IllegalArgumentException {

  public TimeSeriesValidationException(String message) {
    super(message);
  }
}
