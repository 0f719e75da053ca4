package com.codeheadsystems.qcheck.server.content;

/**
 * Identifies the format of a file from its leading bytes.
 */
@FunctionalInterface
public interface SignatureDetector {

  /**
   * Names the signature found in the content, e.g. {@code OOXML}, {@code OLE2},
   * {@code TEXT} or {@code EMPTY}.
   *
   * @param content the raw bytes
   * @return the signature name, never null
   */
  String detect(byte[] content);
}
