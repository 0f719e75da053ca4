package com.codeheadsystems.qcheck.server.upload;

/**
 * Outcome of an upload attempt.
 */
public enum UploadStatus {
  STORED("stored"),
  VALIDATION_ERRORS_PRESENT("validation-errors-present"),
  AUTH_FAILED("auth-failed"),
  SESSION_EXPIRED("session-expired"),
  STORAGE_FAILED("storage-failed");

  private final String label;

  UploadStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
