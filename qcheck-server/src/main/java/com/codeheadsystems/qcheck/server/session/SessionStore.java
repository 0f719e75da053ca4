package com.codeheadsystems.qcheck.server.session;

import java.util.Optional;

/**
 * Durable storage for session records, keyed by session id.
 * <p>
 * Records are never deleted by the application: logout rewrites the expiry into the
 * past and stores the record again. Whether a loaded record is still valid is decided
 * by {@link SessionManager}, not by the store.
 * <p>
 * Implementations must be thread-safe.
 */
public interface SessionStore {

  /**
   * Writes (or overwrites) the record for {@code session.id()}.
   *
   * @param session the session to persist
   * @throws java.io.UncheckedIOException if the record cannot be written
   */
  void store(Session session);

  /**
   * Reads the record for the given id.
   *
   * @param id the session id
   * @return the stored record, or empty if none exists or it cannot be read
   */
  Optional<Session> load(String id);
}
