package com.codeheadsystems.qcheck.model;

/**
 * Severity of a {@link ValidationMessage}.
 */
public enum Severity {
  WARNING("warning"),
  ERROR("error");

  private final String label;

  Severity(String label) {
    this.label = label;
  }

  /**
   * Lower-case label used in rendered reports and CSS class names.
   *
   * @return the label
   */
  public String label() {
    return label;
  }
}
