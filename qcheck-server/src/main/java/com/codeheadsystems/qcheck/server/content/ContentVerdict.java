package com.codeheadsystems.qcheck.server.content;

import java.util.List;

/**
 * Result of checking a file's declared extension and its actual content.
 *
 * @param extension         the lower-cased extension, empty if the filename has none
 * @param extensionOk       whether the extension is allowed
 * @param contentOk         whether the detected signature is acceptable
 * @param detectedSignature the detected signature name
 * @param rejections        one message per failed check
 */
public record ContentVerdict(String extension, boolean extensionOk, boolean contentOk,
                             String detectedSignature, List<String> rejections) {

  public ContentVerdict {
    rejections = rejections == null ? List.of() : List.copyOf(rejections);
  }

  public boolean accepted() {
    return extensionOk && contentOk;
  }
}
