package com.codeheadsystems.qcheck.server.source;

/**
 * One spreadsheet input of a request. The implementation is chosen once, when the request
 * is decoded.
 */
public interface SubmissionSource {

  /**
   * What the user entered for this input, used in messages.
   *
   * @return the file or sheet name
   */
  String inputName();

  /**
   * Obtains the bytes.
   *
   * @return the submission
   * @throws SubmissionException if the source cannot be read
   */
  Submission fetch();
}
