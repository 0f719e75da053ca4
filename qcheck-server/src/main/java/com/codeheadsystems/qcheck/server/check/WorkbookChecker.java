package com.codeheadsystems.qcheck.server.check;

import com.codeheadsystems.qcheck.model.Dataset;
import com.codeheadsystems.qcheck.model.Program;
import com.codeheadsystems.qcheck.model.Severity;
import com.codeheadsystems.qcheck.model.ValidationMessage;
import com.codeheadsystems.qcheck.model.ValidationReport;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Baseline {@link SpreadsheetChecker} for {@code .xls} and {@code .xlsx} workbooks.
 * <p>
 * Every sheet becomes a {@link Dataset}: the first physical row is the header and the
 * rows after it are data rows numbered from 1. Rows whose first cell starts with
 * {@code #} are comments; they keep their row number but are not checked.
 */
@Singleton
public class WorkbookChecker implements SpreadsheetChecker {

  /**
   * Dataset name used for problems with the workbook as a whole.
   */
  public static final String WORKBOOK = "workbook";

  private static final Logger log = LoggerFactory.getLogger(WorkbookChecker.class);
  private static final String COMMENT_PREFIX = "#";

  private final List<SheetRule> sheetRules;

  @Inject
  public WorkbookChecker(final List<SheetRule> sheetRules) {
    this.sheetRules = List.copyOf(sheetRules);
    log.info("WorkbookChecker({} rules)", this.sheetRules.size());
  }

  @Override
  public ValidationReport check(byte[] content, Map<String, Program> programs) {
    ValidationReport.Builder report = ValidationReport.builder();
    try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
      DataFormatter formatter = new DataFormatter(Locale.ROOT);
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
      for (Sheet sheet : workbook) {
        new SheetCheck(sheet, formatter, evaluator, ruleFor(sheet.getSheetName()), programs, report).run();
      }
    } catch (IOException | RuntimeException e) {
      // POI signals malformed content with a family of unchecked exceptions.
      log.debug("Unreadable workbook: {}", e.toString());
      report.message(ValidationMessage.fileLevel(WORKBOOK,
          "Unable to read the file as a spreadsheet: " + e.getMessage(), Severity.ERROR));
    }
    ValidationReport result = report.build();
    log.debug("check() -> {} errors, {} warnings", result.errorCount(), result.warningCount());
    return result;
  }

  private Optional<SheetRule> ruleFor(String sheetName) {
    return sheetRules.stream().filter(r -> r.appliesTo(sheetName)).findFirst();
  }

  /**
   * State for checking one sheet.
   */
  private static class SheetCheck {

    private final Sheet sheet;
    private final DataFormatter formatter;
    private final FormulaEvaluator evaluator;
    private final Optional<SheetRule> rule;
    private final Map<String, Program> programs;
    private final ValidationReport.Builder report;
    private final String name;

    private SheetCheck(Sheet sheet, DataFormatter formatter, FormulaEvaluator evaluator,
                       Optional<SheetRule> rule, Map<String, Program> programs,
                       ValidationReport.Builder report) {
      this.sheet = sheet;
      this.formatter = formatter;
      this.evaluator = evaluator;
      this.rule = rule;
      this.programs = programs;
      this.report = report;
      this.name = sheet.getSheetName();
    }

    private void run() {
      int headerIndex = sheet.getFirstRowNum();
      Row headerRow = headerIndex < 0 ? null : sheet.getRow(headerIndex);
      List<String> header = headerRow == null ? List.of() : header(headerRow);

      List<Row> rawRows = new ArrayList<>();
      List<List<String>> rows = new ArrayList<>();
      if (headerRow != null) {
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
          Row row = sheet.getRow(r);
          rawRows.add(row);
          rows.add(values(row, header.size()));
        }
      }
      Dataset dataset = new Dataset(name, header, rows);
      report.dataset(dataset);

      checkDuplicateHeaders(header);
      rule.ifPresent(r -> applyRule(r, dataset, rawRows));
    }

    private List<String> header(Row row) {
      List<String> names = new ArrayList<>();
      for (int c = 0; c < Math.max(row.getLastCellNum(), 0); c++) {
        names.add(text(row.getCell(c)).orElse(""));
      }
      while (!names.isEmpty() && names.get(names.size() - 1).isEmpty()) {
        names.remove(names.size() - 1);
      }
      return names;
    }

    private List<String> values(Row row, int width) {
      List<String> values = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        values.add(row == null ? null : text(row.getCell(c)).orElse(null));
      }
      return values;
    }

    private Optional<String> text(Cell cell) {
      if (cell == null) {
        return Optional.empty();
      }
      String value = formatter.formatCellValue(cell, evaluator).trim();
      return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private void checkDuplicateHeaders(List<String> header) {
      Set<String> seen = new LinkedHashSet<>();
      Set<String> duplicates = new LinkedHashSet<>();
      for (String column : header) {
        if (!column.isEmpty() && !seen.add(column)) {
          duplicates.add(column);
        }
      }
      if (!duplicates.isEmpty()) {
        report.warning(name, ValidationMessage.HEADER_ROW, List.copyOf(duplicates),
            "Duplicate column name(s): " + String.join(", ", duplicates)
                + ". Only the first occurrence is checked.");
      }
    }

    private void applyRule(SheetRule rule, Dataset dataset, List<Row> rawRows) {
      List<String> header = dataset.columnNames();
      List<String> missing = rule.requiredColumns().stream().filter(c -> !header.contains(c)).toList();
      if (!missing.isEmpty()) {
        report.error(name, ValidationMessage.HEADER_ROW, missing,
            "Required column(s) missing: " + String.join(", ", missing));
      }
      Map<String, Map<String, Integer>> firstSeen = new HashMap<>();
      for (int n = 1; n <= dataset.rowCount(); n++) {
        if (isComment(dataset, n)) {
          continue;
        }
        for (String column : rule.numericColumns()) {
          checkNumeric(dataset, rawRows.get(n - 1), n, column);
        }
        for (String column : rule.uniqueColumns()) {
          checkUnique(dataset, n, column, firstSeen.computeIfAbsent(column, k -> new HashMap<>()));
        }
        if (rule.proposalColumn() != null && header.contains(rule.proposalColumn()) && !programs.isEmpty()) {
          checkProposal(dataset, n, rule.proposalColumn());
        }
      }
    }

    private boolean isComment(Dataset dataset, int n) {
      List<String> row = dataset.rows().get(n - 1);
      return !row.isEmpty() && row.get(0) != null && row.get(0).startsWith(COMMENT_PREFIX);
    }

    private void checkNumeric(Dataset dataset, Row row, int n, String column) {
      int index = dataset.columnNames().indexOf(column);
      if (index < 0) {
        return;
      }
      Optional<String> value = dataset.cell(n, column);
      if (value.isEmpty()) {
        report.error(name, n, List.of(column),
            "Blank value found where a numeric value was expected");
        return;
      }
      if (!isNumeric(row.getCell(index), value.get())) {
        report.error(name, n, List.of(column),
            String.format("Non-numeric value, '%s', found where a numeric value was expected", value.get()));
      }
    }

    private static boolean isNumeric(Cell cell, String text) {
      CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
      if (type == CellType.NUMERIC) {
        return true;
      }
      try {
        Double.parseDouble(text);
        return true;
      } catch (NumberFormatException e) {
        return false;
      }
    }

    private void checkUnique(Dataset dataset, int n, String column, Map<String, Integer> seen) {
      Optional<String> value = dataset.cell(n, column);
      if (value.isEmpty()) {
        return;
      }
      Integer first = seen.putIfAbsent(value.get(), n);
      if (first != null) {
        report.error(name, n, List.of(column),
            String.format("Duplicate value '%s' in column %s (first used in row %d)", value.get(), column, first));
      }
    }

    private void checkProposal(Dataset dataset, int n, String column) {
      Optional<String> value = dataset.cell(n, column);
      if (value.isEmpty()) {
        report.error(name, n, List.of(column), "Blank value found where a proposal id was expected");
      } else if (!programs.containsKey(value.get().toUpperCase(Locale.ROOT))) {
        report.error(name, n, List.of(column),
            String.format("Proposal '%s' does not match the proposal being checked (%s)",
                value.get(), String.join(", ", programs.keySet())));
      }
    }
  }
}
