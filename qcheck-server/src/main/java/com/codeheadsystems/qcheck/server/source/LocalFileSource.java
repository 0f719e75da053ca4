package com.codeheadsystems.qcheck.server.source;

/**
 * A file uploaded as part of the request.
 *
 * @param filename the client's file name
 * @param content  the bytes
 */
public record LocalFileSource(String filename, byte[] content) implements SubmissionSource {

  @Override
  public String inputName() {
    return filename;
  }

  @Override
  public Submission fetch() {
    return new Submission(SubmissionKind.EXCEL_FILE, filename, filename, content);
  }
}
