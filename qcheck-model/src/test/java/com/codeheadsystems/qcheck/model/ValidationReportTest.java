package com.codeheadsystems.qcheck.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationReportTest {

  @Test
  void counts_tallyBySeverity() {
    ValidationReport report = ValidationReport.builder()
        .error("ob", 2, List.of("Code"), "Duplicate code value identified: ob1")
        .warning("ob", ValidationMessage.HEADER_ROW, List.of("Code.1"), "1 duplicate Code column(s)")
        .error("targets", null, List.of(), "Sheet targets is empty")
        .build();

    assertThat(report.errorCount()).isEqualTo(2);
    assertThat(report.warningCount()).isEqualTo(1);
    assertThat(report.isClean()).isFalse();
  }

  @Test
  void datasetNames_keepsDatasetOrderThenMessageOnlyDatasets() {
    ValidationReport report = ValidationReport.builder()
        .dataset(Dataset.empty("targets"))
        .dataset(Dataset.empty("ob"))
        .error("workbook", null, List.of(), "Unable to read workbook")
        .warning("ob", 1, List.of("Code"), "Code was not found in ob sheet")
        .build();

    assertThat(report.datasetNames()).containsExactly("targets", "ob", "workbook");
  }

  @Test
  void messagesFor_filtersByDatasetAndSeverity_inInsertionOrder() {
    ValidationReport report = ValidationReport.builder()
        .error("ob", 3, List.of("A"), "third")
        .warning("ob", 1, List.of("A"), "warned")
        .error("ob", 1, List.of("A"), "first")
        .error("targets", 1, List.of("A"), "other")
        .build();

    assertThat(report.messagesFor("ob", Severity.ERROR))
        .extracting(ValidationMessage::message)
        .containsExactly("third", "first");
  }

  @Test
  void emptyReport_isClean() {
    assertThat(ValidationReport.empty().isClean()).isTrue();
    assertThat(ValidationReport.empty().warningCount()).isZero();
  }

  @Test
  void rowMessage_rejectsRowsBelowOne() {
    assertThatThrownBy(() -> ValidationMessage.row("ob", 0, List.of(), "bad", Severity.ERROR))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
