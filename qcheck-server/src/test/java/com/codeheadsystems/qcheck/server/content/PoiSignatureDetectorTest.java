package com.codeheadsystems.qcheck.server.content;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PoiSignatureDetectorTest {

  private final PoiSignatureDetector detector = new PoiSignatureDetector();

  @Test
  void printableText_isText() {
    assertThat(detector.detect("hello\tworld\r\n".getBytes(StandardCharsets.UTF_8))).isEqualTo("TEXT");
  }

  @Test
  void binaryGarbage_isUnknown() {
    assertThat(detector.detect(new byte[]{0x01, 0x02, 0x03, 0x00, 0x7F, 0x10, 0x11, 0x12})).isEqualTo("UNKNOWN");
  }

  @Test
  void pdfMagic_isReportedByName() {
    assertThat(detector.detect("%PDF-1.4\n".getBytes(StandardCharsets.US_ASCII))).isEqualTo("PDF");
  }
}
