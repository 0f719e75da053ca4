package com.codeheadsystems.qcheck.server.auth;

/**
 * Thrown by a {@link CredentialBackend} that could not be contacted or failed mid-lookup.
 */
public class BackendUnreachableException extends RuntimeException {

  public BackendUnreachableException(String message, Throwable cause) {
    super(message, cause);
  }
}
