package com.codeheadsystems.qcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * A single finding produced while checking a submitted workbook.
 * <p>
 * The row locator distinguishes three cases:
 * <ul>
 *   <li>{@code null}: the message concerns the whole file or sheet;</li>
 *   <li>{@link #HEADER_ROW}: the message concerns the column header row;</li>
 *   <li>{@code N >= 1}: the message concerns the N-th data row of the sheet.</li>
 * </ul>
 *
 * @param dataset  name of the sheet the message belongs to
 * @param row      row locator, see above
 * @param columns  names of the affected columns, in the order they should be shown
 * @param message  free text, may contain untrusted cell contents
 * @param severity warning or error
 */
public record ValidationMessage(
    @JsonProperty("dataset") String dataset,
    @JsonProperty("row") Integer row,
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("message") String message,
    @JsonProperty("severity") Severity severity) {

  /**
   * Reserved row locator for the header row.
   */
  public static final int HEADER_ROW = 0;

  public ValidationMessage {
    Objects.requireNonNull(dataset, "dataset");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(severity, "severity");
    if (row != null && row < HEADER_ROW) {
      throw new IllegalArgumentException("Row locator must not be negative: " + row);
    }
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  public static ValidationMessage fileLevel(String dataset, String message, Severity severity) {
    return new ValidationMessage(dataset, null, List.of(), message, severity);
  }

  public static ValidationMessage header(String dataset, List<String> columns, String message,
                                         Severity severity) {
    return new ValidationMessage(dataset, HEADER_ROW, columns, message, severity);
  }

  public static ValidationMessage row(String dataset, int row, List<String> columns, String message,
                                      Severity severity) {
    if (row < 1) {
      throw new IllegalArgumentException("Data rows are numbered from 1: " + row);
    }
    return new ValidationMessage(dataset, row, columns, message, severity);
  }

  @JsonIgnore
  public boolean isFileLevel() {
    return row == null;
  }

  @JsonIgnore
  public boolean isHeaderRow() {
    return row != null && row == HEADER_ROW;
  }
}
