package com.codeheadsystems.qcheck.server.session;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, validates and invalidates sessions on top of a {@link SessionStore}.
 * <p>
 * A session presented by a client is valid only when a record with the same id has been
 * persisted and the current time is before the record's expiry. The client's copies of
 * the other fields are never trusted.
 */
@Singleton
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final SessionStore sessionStore;
  private final Duration ttl;
  private final Clock clock;

  @Inject
  public SessionManager(final SessionStore sessionStore, final Duration ttl, final Clock clock) {
    this.sessionStore = sessionStore;
    this.ttl = ttl;
    this.clock = clock;
    log.info("SessionManager(ttl={})", ttl);
  }

  /**
   * Creates a new session starting now. Not persisted until {@link #persist(Session)}.
   *
   * @param backend     the backend that authenticated the user
   * @param displayName the user's display name
   * @return the session
   */
  public Session create(String backend, String displayName) {
    Instant now = clock.instant();
    Session session = new Session(newSessionId(now), now, now.plus(ttl), backend, displayName);
    log.debug("create(backend={}) -> id={}", backend, session.id());
    return session;
  }

  /**
   * Persists the session. A write failure is logged and otherwise ignored: the caller
   * continues as if the session were ephemeral.
   *
   * @param session the session
   * @return true if the record was written
   */
  public boolean persist(Session session) {
    try {
      sessionStore.store(session);
      return true;
    } catch (UncheckedIOException e) {
      log.warn("Session {} could not be persisted, continuing without it: {}",
          session.id(), e.getMessage());
      return false;
    }
  }

  /**
   * Whether the client-presented session is backed by a persisted, unexpired record.
   *
   * @param clientSession the presented session, may be null
   * @return true if valid
   */
  public boolean validate(ClientSession clientSession) {
    return resolve(clientSession).isPresent();
  }

  /**
   * The persisted session behind a valid client-presented session.
   *
   * @param clientSession the presented session, may be null
   * @return the stored session, or empty if absent, unknown or expired
   */
  public Optional<Session> resolve(ClientSession clientSession) {
    if (clientSession == null || !clientSession.hasId()) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    Optional<Session> stored = sessionStore.load(clientSession.id())
        .filter(s -> clientSession.id().equals(s.id()));
    if (stored.isEmpty()) {
      log.debug("No session record for presented id");
      return Optional.empty();
    }
    if (!stored.get().isValidAt(now)) {
      log.debug("Session {} expired at {}", stored.get().id(), stored.get().expiresAt());
      return Optional.empty();
    }
    return stored;
  }

  /**
   * Ends a session by moving its expiry into the past and persisting it.
   *
   * @param session the session to end
   * @return the invalidated session
   */
  public Session invalidate(Session session) {
    Session dead = session.withExpiresAt(clock.instant().minusSeconds(1));
    persist(dead);
    log.debug("Invalidated session {}", session.id());
    return dead;
  }

  /**
   * The configured time-to-live.
   *
   * @return the ttl
   */
  public Duration ttl() {
    return ttl;
  }

  // Uniqueness is probabilistic: two requests hashing the same instant and nano counter collide.
  static String newSessionId(Instant now) {
    String seed = now.getEpochSecond() + "." + now.getNano() + "." + System.nanoTime();
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(seed.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
