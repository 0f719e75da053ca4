package com.codeheadsystems.qcheck.server.upload;

/**
 * An upload notification could not be delivered.
 */
public class NotificationException extends RuntimeException {

  public NotificationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
