package com.codeheadsystems.qcheck.server.check;

import com.codeheadsystems.qcheck.model.Program;
import com.codeheadsystems.qcheck.model.ValidationReport;
import java.util.Map;

/**
 * Parses a queue spreadsheet and reports every defect found in it.
 * <p>
 * Implementations never abort on bad content: an unreadable file is itself reported
 * as a file-level error.
 */
public interface SpreadsheetChecker {

  /**
   * Checks a workbook.
   *
   * @param content  the workbook bytes
   * @param programs the programs the file may refer to, keyed by upper-cased proposal id
   * @return the report
   */
  ValidationReport check(byte[] content, Map<String, Program> programs);
}
