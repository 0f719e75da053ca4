package com.codeheadsystems.qcheck.server.source;

/**
 * Where a submitted spreadsheet came from.
 */
public enum SubmissionKind {
  EXCEL_FILE("Excel file", "uploaded"),
  EXTERNAL_SHEET("Google sheet", "submitted");

  private final String label;
  private final String verb;

  SubmissionKind(String label, String verb) {
    this.label = label;
    this.verb = verb;
  }

  public String label() {
    return label;
  }

  /**
   * Past-tense verb used in notifications, e.g. "uploaded".
   *
   * @return the verb
   */
  public String verb() {
    return verb;
  }
}
