package com.codeheadsystems.qcheck.server.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * An authenticated session.
 * <p>
 * {@code expiresAt} is exactly the configured TTL after {@code createdAt} unless the
 * session was invalidated, in which case it lies in the past.
 *
 * @param id          opaque session identifier, the only field a client must present
 * @param createdAt   when the user authenticated
 * @param expiresAt   instant from which the session is no longer valid
 * @param backend     name of the credential backend that authenticated the user
 * @param displayName display name reported by that backend
 */
public record Session(
    @JsonProperty("id") String id,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("expiresAt") Instant expiresAt,
    @JsonProperty("backend") String backend,
    @JsonProperty("displayName") String displayName) {

  public Session {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  /**
   * Whether the session is still valid at the given instant.
   *
   * @param now the instant to test
   * @return true when {@code now} is before the expiry
   */
  public boolean isValidAt(Instant now) {
    return now.isBefore(expiresAt);
  }

  /**
   * Copy of this session with a different expiry.
   *
   * @param newExpiry the expiry
   * @return the copy
   */
  public Session withExpiresAt(Instant newExpiry) {
    return new Session(id, createdAt, newExpiry, backend, displayName);
  }
}
