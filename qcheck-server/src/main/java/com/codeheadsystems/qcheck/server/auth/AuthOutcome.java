package com.codeheadsystems.qcheck.server.auth;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Overall result of a login attempt across every backend that was tried.
 *
 * @param success     whether any backend accepted the credentials
 * @param backend     the accepting backend, null on failure
 * @param displayName the accepting backend's display name, null on failure
 * @param attempts    each backend attempt, in the order tried
 */
public record AuthOutcome(boolean success, String backend, String displayName,
                          List<CredentialAttempt> attempts) {

  public AuthOutcome {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  /**
   * Every failed attempt's reason, tagged with its backend and joined for display,
   * e.g. {@code "ldap: backend unreachable; database: credentials rejected"}.
   *
   * @return the combined reason, empty on success
   */
  public String failureReason() {
    if (success) {
      return "";
    }
    return attempts.stream()
        .filter(a -> !a.success())
        .map(a -> a.backend() + ": " + a.failureReason())
        .collect(Collectors.joining("; "));
  }
}
