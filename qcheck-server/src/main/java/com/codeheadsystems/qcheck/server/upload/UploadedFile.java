package com.codeheadsystems.qcheck.server.upload;

import com.codeheadsystems.qcheck.server.source.SubmissionKind;
import java.nio.file.Path;
import java.time.Instant;

/**
 * A file written to the upload store.
 *
 * @param originalFilename the name the file was submitted under
 * @param proposalId       the proposal it was filed under
 * @param extension        the lower-cased extension
 * @param content          the bytes written
 * @param destination      where it was written
 * @param uploadedAt       when it was written
 * @param kind             where the submission came from
 * @param inputName        what the user entered for it
 */
public record UploadedFile(String originalFilename, String proposalId, String extension, byte[] content,
                           Path destination, Instant uploadedAt, SubmissionKind kind, String inputName) {
}
