package com.codeheadsystems.qcheck.server.auth;

/**
 * Result of asking one backend. Never carries the secret.
 *
 * @param username      the username tried
 * @param backend       the backend name
 * @param success       whether the backend accepted the credentials
 * @param failureReason why it did not, null on success
 * @param displayName   the display name on success, null otherwise
 */
public record CredentialAttempt(String username, String backend, boolean success,
                                String failureReason, String displayName) {

  public static CredentialAttempt succeeded(String username, String backend, String displayName) {
    return new CredentialAttempt(username, backend, true, null, displayName);
  }

  public static CredentialAttempt failed(String username, String backend, String reason) {
    return new CredentialAttempt(username, backend, false, reason, null);
  }
}
