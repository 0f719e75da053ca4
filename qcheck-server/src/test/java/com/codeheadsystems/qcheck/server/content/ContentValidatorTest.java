package com.codeheadsystems.qcheck.server.content;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.qcheck.server.config.QcheckConfig;
import com.codeheadsystems.qcheck.server.fixture.WorkbookFixtures;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentValidatorTest {

  private static final byte[] XLSX = WorkbookFixtures.xlsx("Targets", new Object[]{"Code", "RA"});
  private static final byte[] XLS = WorkbookFixtures.xls("Targets", new Object[]{"Code", "RA"});
  private static final byte[] TEXT = "Code,RA\nT1,10.5\n".getBytes(StandardCharsets.UTF_8);

  private ContentValidator validator;

  @BeforeEach
  void setUp() {
    validator = new ContentValidator(QcheckConfig.EXCEL_SIGNATURES, new PoiSignatureDetector());
  }

  @Test
  void xlsxWithOoxmlContent_isAccepted() {
    ContentVerdict verdict = validator.validate("S22B-QN001.xlsx", XLSX);

    assertThat(verdict.accepted()).isTrue();
    assertThat(verdict.detectedSignature()).isEqualTo("OOXML");
    assertThat(verdict.rejections()).isEmpty();
  }

  @Test
  void xlsWithOle2Content_isAccepted() {
    ContentVerdict verdict = validator.validate("old.XLS", XLS);

    assertThat(verdict.extension()).isEqualTo("xls");
    assertThat(verdict.accepted()).isTrue();
    assertThat(verdict.detectedSignature()).isEqualTo("OLE2");
  }

  @Test
  void textFileWithTxtExtension_failsBothChecksIndependently() {
    ContentVerdict verdict = validator.validate("prop.txt", TEXT);

    assertThat(verdict.extensionOk()).isFalse();
    assertThat(verdict.contentOk()).isFalse();
    assertThat(verdict.rejections()).containsExactly(
        "File extension 'txt' is not a valid file type. Must be one of xlsx, xls.",
        "File content type 'TEXT' does not match the expected content for a .txt file "
            + "(expected one of OOXML, OLE2, BIFF2, BIFF3, BIFF4).");
  }

  @Test
  void textBytesNamedXlsx_isContentRejected() {
    ContentVerdict verdict = validator.validate("prop.xlsx", TEXT);

    assertThat(verdict.extensionOk()).isTrue();
    assertThat(verdict.contentOk()).isFalse();
    assertThat(verdict.rejections()).containsExactly(
        "File content type 'TEXT' does not match the expected content for a .xlsx file (expected one of OOXML).");
  }

  @Test
  void workbookWithWrongExtension_onlyExtensionFails() {
    ContentVerdict verdict = validator.validate("prop.csv", XLSX);

    assertThat(verdict.extensionOk()).isFalse();
    assertThat(verdict.contentOk()).isTrue();
    assertThat(verdict.rejections()).hasSize(1);
  }

  @Test
  void legacyWorkbookNamedXlsx_isContentRejected() {
    ContentVerdict verdict = validator.validate("prop.xlsx", XLS);

    assertThat(verdict.contentOk()).isFalse();
    assertThat(verdict.detectedSignature()).isEqualTo("OLE2");
  }

  @Test
  void emptyFile_isReportedAsEmpty() {
    ContentVerdict verdict = validator.validate("prop.xlsx", new byte[0]);

    assertThat(verdict.detectedSignature()).isEqualTo(PoiSignatureDetector.EMPTY);
    assertThat(verdict.accepted()).isFalse();
  }

  @Test
  void extensionOf_usesLastSegmentAndLastDot() {
    assertThat(ContentValidator.extensionOf("C:\\data\\my.queue.XLSX")).isEqualTo("xlsx");
    assertThat(ContentValidator.extensionOf("dir.d/noext")).isEmpty();
    assertThat(ContentValidator.extensionOf(null)).isEmpty();
  }
}
