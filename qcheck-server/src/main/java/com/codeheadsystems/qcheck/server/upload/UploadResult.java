package com.codeheadsystems.qcheck.server.upload;

/**
 * Result of {@link UploadManager#store}.
 *
 * @param status  what happened
 * @param file    the stored file, only set when {@code status} is {@link UploadStatus#STORED}
 * @param message text for the user
 */
public record UploadResult(UploadStatus status, UploadedFile file, String message) {

  public static UploadResult rejected(UploadStatus status, String message) {
    return new UploadResult(status, null, message);
  }

  public boolean stored() {
    return status == UploadStatus.STORED;
  }
}
