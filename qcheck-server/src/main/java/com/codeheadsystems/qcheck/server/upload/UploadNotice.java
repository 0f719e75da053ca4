package com.codeheadsystems.qcheck.server.upload;

/**
 * What a {@link Notifier} is told about a stored upload.
 *
 * @param file        the stored file
 * @param backend     the backend that authenticated the uploader
 * @param displayName the uploader's display name
 */
public record UploadNotice(UploadedFile file, String backend, String displayName) {
}
