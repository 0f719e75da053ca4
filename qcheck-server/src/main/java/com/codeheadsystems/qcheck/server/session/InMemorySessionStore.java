package com.codeheadsystems.qcheck.server.session;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on restart. Suitable for development and testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Session> store = new ConcurrentHashMap<>();

  @Override
  public void store(Session session) {
    store.put(session.id(), session);
    log.debug("Stored session id={}", session.id());
  }

  @Override
  public Optional<Session> load(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(store.get(id));
  }
}
