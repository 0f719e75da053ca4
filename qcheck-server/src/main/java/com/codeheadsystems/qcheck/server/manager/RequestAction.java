package com.codeheadsystems.qcheck.server.manager;

import java.util.Locale;

/**
 * What a request asks for.
 */
public enum RequestAction {
  LOGIN,
  LOGOUT,
  CHECK,
  UPLOAD,
  LIST_FILES;

  /**
   * Parses a form value such as {@code check} or {@code list_files}.
   *
   * @param value the value
   * @return the action
   * @throws IllegalArgumentException if the value is missing or unknown
   */
  public static RequestAction fromFormValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("An action is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown action: " + value, e);
    }
  }
}
