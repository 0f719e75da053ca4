package com.codeheadsystems.qcheck.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionManagerTest {

  private static final Instant NOW = Instant.parse("2022-03-01T10:00:00Z");
  private static final Duration TTL = Duration.ofHours(3);

  private InMemorySessionStore store;
  private SessionManager manager;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore();
    manager = managerAt(NOW);
  }

  private SessionManager managerAt(Instant instant) {
    return new SessionManager(store, TTL, Clock.fixed(instant, ZoneOffset.UTC));
  }

  @Test
  void create_setsExpiryExactlyOneTtlAfterCreation() {
    Session session = manager.create("ldap", "Jane Observer");

    assertThat(session.createdAt()).isEqualTo(NOW);
    assertThat(session.expiresAt()).isEqualTo(NOW.plus(TTL));
    assertThat(session.backend()).isEqualTo("ldap");
    assertThat(session.displayName()).isEqualTo("Jane Observer");
    assertThat(session.id()).matches("[0-9a-f]{64}");
  }

  @Test
  void create_generatesDistinctIds() {
    assertThat(manager.create("ldap", "a").id()).isNotEqualTo(manager.create("ldap", "a").id());
  }

  @Test
  void validate_persistedAndUnexpired_isTrue() {
    Session session = manager.create("ldap", "Jane");
    manager.persist(session);

    assertThat(manager.validate(ClientSession.ofId(session.id()))).isTrue();
    assertThat(managerAt(NOW.plus(TTL).minusSeconds(1)).validate(ClientSession.ofId(session.id()))).isTrue();
  }

  @Test
  void validate_atOrAfterExpiry_isFalse() {
    Session session = manager.create("ldap", "Jane");
    manager.persist(session);

    assertThat(managerAt(NOW.plus(TTL)).validate(ClientSession.ofId(session.id()))).isFalse();
    assertThat(managerAt(NOW.plus(TTL).plusSeconds(60)).validate(ClientSession.ofId(session.id()))).isFalse();
  }

  @Test
  void validate_notPersisted_isFalse() {
    Session session = manager.create("ldap", "Jane");

    assertThat(manager.validate(ClientSession.ofId(session.id()))).isFalse();
  }

  @Test
  void validate_unknownOrMissingId_isFalseWithoutThrowing() {
    assertThatCode(() -> {
      assertThat(manager.validate(ClientSession.ofId("deadbeef"))).isFalse();
      assertThat(manager.validate(ClientSession.NONE)).isFalse();
      assertThat(manager.validate(null)).isFalse();
    }).doesNotThrowAnyException();
  }

  @Test
  void validate_ignoresClientCopiesOfOtherFields() {
    Session session = manager.create("ldap", "Jane");
    manager.persist(session);
    ClientSession forged = new ClientSession(session.id(), "2000-01-01T00:00:00Z",
        "2999-01-01T00:00:00Z", "other", "Mallory");

    Optional<Session> resolved = managerAt(NOW.plus(TTL)).resolve(forged);

    assertThat(resolved).isEmpty();
    assertThat(manager.resolve(forged)).contains(session);
  }

  @Test
  void invalidate_setsExpiryOneSecondInThePast() {
    Session session = manager.create("database", "Jane");
    manager.persist(session);

    Session dead = manager.invalidate(session);

    assertThat(dead.expiresAt()).isEqualTo(NOW.minusSeconds(1));
    assertThat(store.load(session.id())).contains(dead);
    assertThat(manager.validate(ClientSession.ofId(session.id()))).isFalse();
  }

  @Test
  void persist_writeFailure_isNonFatal() {
    SessionStore failing = mock(SessionStore.class);
    doThrow(new UncheckedIOException(new IOException("disk full"))).when(failing).store(any());
    when(failing.load(any())).thenReturn(Optional.empty());
    SessionManager failingManager = new SessionManager(failing, TTL, Clock.fixed(NOW, ZoneOffset.UTC));
    Session session = failingManager.create("ldap", "Jane");

    assertThat(failingManager.persist(session)).isFalse();
    assertThat(failingManager.validate(ClientSession.ofId(session.id()))).isFalse();
  }
}
