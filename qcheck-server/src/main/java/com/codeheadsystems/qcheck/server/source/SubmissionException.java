package com.codeheadsystems.qcheck.server.source;

/**
 * A submission could not be obtained from its source. Shown to the user.
 */
public class SubmissionException extends RuntimeException {

  public SubmissionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
