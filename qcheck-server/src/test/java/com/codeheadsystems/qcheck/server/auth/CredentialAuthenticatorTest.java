package com.codeheadsystems.qcheck.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CredentialAuthenticatorTest {

  private static final String USER = "jane@example.org";
  private static final String SECRET = "s3cret";

  @Mock private CredentialBackend primary;
  @Mock private CredentialBackend secondary;

  private CredentialAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    when(primary.name()).thenReturn("ldap");
    when(secondary.name()).thenReturn("database");
    authenticator = new CredentialAuthenticator(primary, secondary);
  }

  @Test
  void primarySuccess_doesNotTrySecondary() {
    when(primary.authenticate(USER, SECRET)).thenReturn(Optional.of("Jane Observer"));

    AuthOutcome outcome = authenticator.authenticate(USER, SECRET);

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.backend()).isEqualTo("ldap");
    assertThat(outcome.displayName()).isEqualTo("Jane Observer");
    assertThat(outcome.attempts()).hasSize(1);
    verify(secondary, never()).authenticate(any(), any());
  }

  @Test
  void primaryUnreachable_secondarySuccess_usesSecondaryDisplayName() {
    when(primary.authenticate(USER, SECRET))
        .thenThrow(new BackendUnreachableException("connection refused", null));
    when(secondary.authenticate(USER, SECRET)).thenReturn(Optional.of("Jane Q. Observer"));

    AuthOutcome outcome = authenticator.authenticate(USER, SECRET);

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.backend()).isEqualTo("database");
    assertThat(outcome.displayName()).isEqualTo("Jane Q. Observer");
    assertThat(outcome.attempts()).extracting(CredentialAttempt::failureReason)
        .containsExactly(CredentialAuthenticator.UNREACHABLE, null);
  }

  @Test
  void primaryRejects_stillFallsBackToSecondary() {
    when(primary.authenticate(USER, SECRET)).thenReturn(Optional.empty());
    when(secondary.authenticate(USER, SECRET)).thenReturn(Optional.of("Jane"));

    AuthOutcome outcome = authenticator.authenticate(USER, SECRET);

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.backend()).isEqualTo("database");
  }

  @Test
  void bothFail_combinesReasons() {
    when(primary.authenticate(USER, SECRET))
        .thenThrow(new BackendUnreachableException("timeout", null));
    when(secondary.authenticate(USER, SECRET)).thenReturn(Optional.empty());

    AuthOutcome outcome = authenticator.authenticate(USER, SECRET);

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.backend()).isNull();
    assertThat(outcome.failureReason())
        .isEqualTo("ldap: backend unreachable; database: credentials rejected");
  }

  @Test
  void attempts_neverCarryTheSecret() {
    when(primary.authenticate(USER, SECRET)).thenReturn(Optional.empty());
    when(secondary.authenticate(USER, SECRET)).thenReturn(Optional.empty());

    AuthOutcome outcome = authenticator.authenticate(USER, SECRET);

    assertThat(outcome.toString()).doesNotContain(SECRET);
  }

  @Test
  void blankInput_throwsIllegalArgument() {
    assertThatThrownBy(() -> authenticator.authenticate(" ", SECRET))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> authenticator.authenticate(USER, ""))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
