package com.codeheadsystems.qcheck.server.auth;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates credentials against a primary backend, falling back to a secondary one.
 * <p>
 * The secondary backend is consulted whenever the primary does not accept the
 * credentials, whether it rejected them or could not be reached.
 */
@Singleton
public class CredentialAuthenticator {

  static final String UNREACHABLE = "backend unreachable";
  static final String REJECTED = "credentials rejected";

  private static final Logger log = LoggerFactory.getLogger(CredentialAuthenticator.class);

  private final List<CredentialBackend> backends;

  @Inject
  public CredentialAuthenticator(final CredentialBackend primary, final CredentialBackend secondary) {
    this.backends = List.of(primary, secondary);
    log.info("CredentialAuthenticator(primary={}, secondary={})", primary.name(), secondary.name());
  }

  /**
   * Tries each backend in order until one accepts.
   *
   * @param username the username
   * @param secret   the secret
   * @return the outcome, listing every attempt made
   * @throws IllegalArgumentException if the username or secret is blank
   */
  public AuthOutcome authenticate(String username, String secret) {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("Username is required");
    }
    if (secret == null || secret.isBlank()) {
      throw new IllegalArgumentException("Password is required");
    }
    List<CredentialAttempt> attempts = new ArrayList<>();
    for (CredentialBackend backend : backends) {
      CredentialAttempt attempt = attempt(backend, username, secret);
      attempts.add(attempt);
      if (attempt.success()) {
        log.info("User {} authenticated by {}", username, backend.name());
        return new AuthOutcome(true, backend.name(), attempt.displayName(), attempts);
      }
    }
    AuthOutcome outcome = new AuthOutcome(false, null, null, attempts);
    log.info("Authentication failed for {}: {}", username, outcome.failureReason());
    return outcome;
  }

  private CredentialAttempt attempt(CredentialBackend backend, String username, String secret) {
    try {
      Optional<String> displayName = backend.authenticate(username, secret);
      if (displayName.isPresent()) {
        return CredentialAttempt.succeeded(username, backend.name(), displayName.get());
      }
      log.debug("{} rejected credentials for {}", backend.name(), username);
      return CredentialAttempt.failed(username, backend.name(), REJECTED);
    } catch (BackendUnreachableException e) {
      log.warn("{} unreachable: {}", backend.name(), e.getMessage());
      return CredentialAttempt.failed(username, backend.name(), UNREACHABLE);
    }
  }
}
