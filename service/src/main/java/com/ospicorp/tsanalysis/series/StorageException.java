package com.ospicorp.tsanalysis.series;

public class StorageException extends RuntimeException {
  private final boolean transientFailure;

  public StorageException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public StorageException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }
}
