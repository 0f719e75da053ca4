package com.codeheadsystems.qcheck.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tabular contents of one sheet of a submitted workbook.
 * <p>
 * Rows are numbered from 1 (the first row after the header), which matches the
 * row locator of {@link ValidationMessage}. Cells may be {@code null} when the
 * spreadsheet had no value.
 *
 * @param name        sheet name
 * @param columnNames header row values, in sheet order
 * @param rows        data rows, each aligned with {@code columnNames}
 */
public record Dataset(
    @JsonProperty("name") String name,
    @JsonProperty("columnNames") List<String> columnNames,
    @JsonProperty("rows") List<List<String>> rows) {

  public Dataset {
    Objects.requireNonNull(name, "name");
    columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
    List<List<String>> copy = new ArrayList<>();
    if (rows != null) {
      for (List<String> row : rows) {
        // List.copyOf rejects null elements and blank cells are legitimately null.
        copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
      }
    }
    rows = Collections.unmodifiableList(copy);
  }

  /**
   * An empty sheet with no header.
   *
   * @param name the sheet name
   * @return the dataset
   */
  public static Dataset empty(String name) {
    return new Dataset(name, List.of(), List.of());
  }

  /**
   * Number of data rows.
   *
   * @return the row count
   */
  public int rowCount() {
    return rows.size();
  }

  /**
   * Whether the 1-based data row exists.
   *
   * @param row the row number
   * @return true if present
   */
  public boolean hasRow(int row) {
    return row >= 1 && row <= rows.size();
  }

  /**
   * Looks up a cell by 1-based data row and column name. Returns empty when the
   * row or column does not exist or the cell is blank.
   *
   * @param row    the row number
   * @param column the column name
   * @return the cell value
   */
  public Optional<String> cell(int row, String column) {
    if (!hasRow(row)) {
      return Optional.empty();
    }
    int index = columnNames.indexOf(column);
    List<String> values = rows.get(row - 1);
    if (index < 0 || index >= values.size()) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(index));
  }
}
