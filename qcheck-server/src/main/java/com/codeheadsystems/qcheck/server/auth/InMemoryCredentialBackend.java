package com.codeheadsystems.qcheck.server.auth;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialBackend} holding a fixed set of users in memory.
 * <p>
 * Passwords are kept in plain text. Suitable for development and testing only.
 */
public class InMemoryCredentialBackend implements CredentialBackend {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialBackend.class);

  private final String name;
  private final Map<String, User> users;

  /**
   * Instantiates a new in-memory backend.
   *
   * @param name  the backend name
   * @param users the known users, keyed by username
   */
  public InMemoryCredentialBackend(String name, Map<String, User> users) {
    this.name = name;
    this.users = Map.copyOf(users);
    log.warn("InMemoryCredentialBackend({}) holds {} plain-text users; do not use in production",
        name, this.users.size());
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Optional<String> authenticate(String username, String secret) {
    User user = users.get(username);
    if (user == null || !user.password().equals(secret)) {
      return Optional.empty();
    }
    return Optional.of(user.displayName());
  }

  /**
   * A development user.
   *
   * @param password    the plain-text password
   * @param displayName the display name
   */
  public record User(String password, String displayName) {
  }
}
