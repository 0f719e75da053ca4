package com.codeheadsystems.qcheck.server.source;

/**
 * A spreadsheet ready to be checked.
 *
 * @param kind      where it came from
 * @param inputName what the user entered: the uploaded file name or the external sheet name
 * @param filename  the file name used for extension checks and storage
 * @param content   the bytes
 */
public record Submission(SubmissionKind kind, String inputName, String filename, byte[] content) {
}
