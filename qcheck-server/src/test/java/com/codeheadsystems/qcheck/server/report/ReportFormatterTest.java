package com.codeheadsystems.qcheck.server.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.qcheck.model.Dataset;
import com.codeheadsystems.qcheck.model.Severity;
import com.codeheadsystems.qcheck.model.ValidationMessage;
import com.codeheadsystems.qcheck.model.ValidationReport;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReportFormatterTest {

  private ReportFormatter formatter;
  private ValidationReport report;

  @BeforeEach
  void setUp() {
    formatter = new ReportFormatter();
    Dataset targets = new Dataset("Targets", List.of("Code", "RA", "Dec"), List.of(
        Arrays.asList("T1", "<b>x</b>", null),
        Arrays.asList("T2", "10.0", "2.0")));
    report = ValidationReport.builder()
        .dataset(targets)
        .error("Targets", 1, List.of("RA", "Dec"), "Non-numeric value, '<b>x</b>', found")
        .warning("Targets", ValidationMessage.HEADER_ROW, List.of("Code"), "Duplicate column name(s): Code")
        .error("Targets", null, List.of(), "Sheet is \"odd\" & 'strange'")
        .error("Targets", 7, List.of("RA"), "Row beyond the sheet")
        .error("workbook", null, List.of(), "Unable to read")
        .build();
  }

  @Test
  void format_rendersRowExcerptWithFlaggedCellsAndPlaceholders() {
    String html = formatter.format(report, Severity.ERROR);

    assertThat(html).contains("<p class=\"qcheck-error\">Row 1: Non-numeric value, &#39;&lt;b&gt;x&lt;/b&gt;&#39;, found</p>");
    assertThat(html).contains("<tr><th>RA</th><th>Dec</th></tr><tr>"
        + "<td class=\"qcheck-error\">&lt;b&gt;x&lt;/b&gt;</td><td class=\"qcheck-error\">&nbsp;</td></tr>");
    assertThat(html).doesNotContain("null").doesNotContain("NaN").doesNotContain("<b>x");
  }

  @Test
  void format_fileLevelAndOutOfRangeMessagesHaveNoTable() {
    String html = formatter.format(report, Severity.ERROR);

    assertThat(html).contains("<p class=\"qcheck-error\">Sheet is &quot;odd&quot; &amp; &#39;strange&#39;</p>");
    assertThat(html).contains("<p class=\"qcheck-error\">Row 7: Row beyond the sheet</p>\n</div>");
    assertThat(html).contains("<h3>workbook</h3>\n<p class=\"qcheck-error\">Unable to read</p>");
  }

  @Test
  void format_followsDatasetThenMessageOrder() {
    String html = formatter.format(report, Severity.ERROR);

    assertThat(html.indexOf("Row 1:")).isLessThan(html.indexOf("odd"));
    assertThat(html.indexOf("odd")).isLessThan(html.indexOf("Row 7:"));
    assertThat(html.indexOf("Row 7:")).isLessThan(html.indexOf("<h3>workbook</h3>"));
  }

  @Test
  void format_headerMessageListsColumns() {
    String html = formatter.format(report, Severity.WARNING);

    assertThat(html).contains("<p class=\"qcheck-warning\">Header: Duplicate column name(s): Code</p>\n"
        + "<table class=\"qcheck-excerpt\"><tr><th class=\"qcheck-warning\">Code</th></tr></table>");
    assertThat(html).doesNotContain("qcheck-error").doesNotContain("workbook");
  }

  @Test
  void format_isIdempotent() {
    assertThat(formatter.format(report, Severity.ERROR)).isEqualTo(formatter.format(report, Severity.ERROR));
  }

  @Test
  void format_noMessagesOfSeverity_isEmpty() {
    assertThat(formatter.format(ValidationReport.empty(), Severity.ERROR)).isEmpty();
  }

  @Test
  void summary_countsErrorsAndWarnings() {
    assertThat(formatter.summary(report)).isEqualTo("<p class=\"qcheck-summary\">4 errors, 1 warning</p>\n");
  }
}
