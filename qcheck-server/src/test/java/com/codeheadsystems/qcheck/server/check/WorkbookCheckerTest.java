package com.codeheadsystems.qcheck.server.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.codeheadsystems.qcheck.model.Program;
import com.codeheadsystems.qcheck.model.Severity;
import com.codeheadsystems.qcheck.model.ValidationMessage;
import com.codeheadsystems.qcheck.model.ValidationReport;
import com.codeheadsystems.qcheck.server.fixture.WorkbookFixtures;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkbookCheckerTest {

  private static final Map<String, Program> PROGRAMS = Map.of("S22B-QN001", Program.forProposal("S22B-QN001"));
  private static final SheetRule TARGETS = new SheetRule("targets", List.of("Code", "RA", "Dec"),
      List.of("RA", "Dec"), List.of("Code"), "Proposal");

  private WorkbookChecker checker;

  @BeforeEach
  void setUp() {
    checker = new WorkbookChecker(List.of(TARGETS));
  }

  @Test
  void cleanWorkbook_hasNoMessages() {
    byte[] content = WorkbookFixtures.xlsx("Targets",
        new Object[]{"Code", "RA", "Dec", "Proposal"},
        new Object[]{"T1", 150.1, 2.2, "S22B-QN001"},
        new Object[]{"T2", 151.0, 2.5, "s22b-qn001"});

    ValidationReport report = checker.check(content, PROGRAMS);

    assertThat(report.messages()).isEmpty();
    assertThat(report.dataset("Targets")).get().satisfies(d -> {
      assertThat(d.columnNames()).containsExactly("Code", "RA", "Dec", "Proposal");
      assertThat(d.rowCount()).isEqualTo(2);
      assertThat(d.cell(1, "Code")).contains("T1");
    });
  }

  @Test
  void defectsAreAllReportedWithRowLocators() {
    byte[] content = WorkbookFixtures.xls("Targets",
        new Object[]{"Code", "RA", "Dec", "Proposal"},
        new Object[]{"T1", "abc", 2.2, "S22B-QN001"},
        new Object[]{"T1", 151.0, null, "S22A-QN999"});

    ValidationReport report = checker.check(content, PROGRAMS);

    assertThat(report.errorCount()).isEqualTo(4);
    assertThat(report.messages()).extracting(ValidationMessage::row, ValidationMessage::columns)
        .containsExactly(
            tuple(1, List.of("RA")),
            tuple(2, List.of("Dec")),
            tuple(2, List.of("Code")),
            tuple(2, List.of("Proposal")));
    assertThat(report.messages().get(0).message())
        .isEqualTo("Non-numeric value, 'abc', found where a numeric value was expected");
    assertThat(report.messages().get(1).message())
        .isEqualTo("Blank value found where a numeric value was expected");
  }

  @Test
  void missingRequiredColumn_isHeaderError() {
    byte[] content = WorkbookFixtures.xlsx("Targets",
        new Object[]{"Code", "RA"},
        new Object[]{"T1", 1.0});

    ValidationReport report = checker.check(content, PROGRAMS);

    ValidationMessage message = report.messagesFor("Targets", Severity.ERROR).get(0);
    assertThat(message.isHeaderRow()).isTrue();
    assertThat(message.columns()).containsExactly("Dec");
  }

  @Test
  void duplicateHeader_isHeaderWarning() {
    byte[] content = WorkbookFixtures.xlsx("Notes",
        new Object[]{"Code", "Comment", "Comment"},
        new Object[]{"T1", "a", "b"});

    ValidationReport report = checker.check(content, PROGRAMS);

    assertThat(report.errorCount()).isZero();
    assertThat(report.messagesFor("Notes", Severity.WARNING)).singleElement()
        .satisfies(m -> {
          assertThat(m.isHeaderRow()).isTrue();
          assertThat(m.columns()).containsExactly("Comment");
        });
  }

  @Test
  void commentRows_keepNumberingButAreNotChecked() {
    byte[] content = WorkbookFixtures.xlsx("Targets",
        new Object[]{"Code", "RA", "Dec", "Proposal"},
        new Object[]{"# calibration stars follow", null, null, null},
        new Object[]{"T1", "bad", 1.0, "S22B-QN001"});

    ValidationReport report = checker.check(content, PROGRAMS);

    assertThat(report.messages()).singleElement().extracting(ValidationMessage::row).isEqualTo(2);
  }

  @Test
  void unreadableContent_isSingleFileLevelError() {
    ValidationReport report = checker.check("not a workbook".getBytes(StandardCharsets.UTF_8), PROGRAMS);

    assertThat(report.messages()).singleElement().satisfies(m -> {
      assertThat(m.dataset()).isEqualTo(WorkbookChecker.WORKBOOK);
      assertThat(m.isFileLevel()).isTrue();
      assertThat(m.severity()).isEqualTo(Severity.ERROR);
    });
  }
}
