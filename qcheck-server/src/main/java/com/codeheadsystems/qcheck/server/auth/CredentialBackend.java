package com.codeheadsystems.qcheck.server.auth;

import java.util.Optional;

/**
 * A source of truth for username/secret pairs.
 * <p>
 * Implementations distinguish two failure kinds: credentials the backend looked at and
 * rejected (an empty result), and a backend that could not be asked at all
 * ({@link BackendUnreachableException}).
 */
public interface CredentialBackend {

  /**
   * Short name shown to users and recorded on sessions, e.g. {@code ldap}.
   *
   * @return the backend name
   */
  String name();

  /**
   * Checks the credentials.
   *
   * @param username the username
   * @param secret   the secret; implementations must never log it
   * @return the user's display name if the credentials are accepted, empty if rejected
   * @throws BackendUnreachableException if the backend cannot be contacted
   */
  Optional<String> authenticate(String username, String secret);
}
