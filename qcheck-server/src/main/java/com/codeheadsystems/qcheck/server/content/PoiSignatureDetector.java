package com.codeheadsystems.qcheck.server.content;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SignatureDetector} backed by Apache POI's {@link FileMagic}.
 * <p>
 * POI's names are reported as-is ({@code OOXML}, {@code OLE2}, {@code BIFF2} ...).
 * Content POI cannot identify is reported as {@code TEXT} when its head is printable and
 * {@code UNKNOWN} otherwise.
 */
public class PoiSignatureDetector implements SignatureDetector {

  public static final String EMPTY = "EMPTY";
  public static final String TEXT = "TEXT";
  public static final String UNKNOWN = "UNKNOWN";

  private static final Logger log = LoggerFactory.getLogger(PoiSignatureDetector.class);
  private static final int TEXT_SNIFF_LENGTH = 512;

  @Override
  public String detect(byte[] content) {
    // FileMagic throws EmptyFileException on zero bytes.
    if (content == null || content.length == 0) {
      return EMPTY;
    }
    FileMagic magic;
    try (InputStream in = FileMagic.prepareToCheckMagic(new ByteArrayInputStream(content))) {
      magic = FileMagic.valueOf(in);
    } catch (IOException e) {
      log.debug("Signature detection failed: {}", e.getMessage());
      return UNKNOWN;
    }
    if (magic == FileMagic.UNKNOWN) {
      return isPrintable(content) ? TEXT : UNKNOWN;
    }
    return magic.name();
  }

  static boolean isPrintable(byte[] content) {
    int limit = Math.min(content.length, TEXT_SNIFF_LENGTH);
    for (int i = 0; i < limit; i++) {
      int b = content[i] & 0xFF;
      if (b < 0x20 && b != '\t' && b != '\n' && b != '\r' && b != '\f') {
        return false;
      }
      if (b == 0x7F) {
        return false;
      }
    }
    return true;
  }
}
