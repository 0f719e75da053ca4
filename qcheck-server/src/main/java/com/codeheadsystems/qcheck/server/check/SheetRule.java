package com.codeheadsystems.qcheck.server.check;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Baseline checks applied to one sheet of a submitted workbook.
 *
 * @param sheet           sheet name, matched case-insensitively; {@code *} matches any sheet
 * @param requiredColumns columns that must be present in the header
 * @param numericColumns  columns whose every data cell must be a number
 * @param uniqueColumns   columns whose values must not repeat
 * @param proposalColumn  column holding the proposal id each row belongs to, may be null
 */
public record SheetRule(
    @JsonProperty("sheet") String sheet,
    @JsonProperty("requiredColumns") List<String> requiredColumns,
    @JsonProperty("numericColumns") List<String> numericColumns,
    @JsonProperty("uniqueColumns") List<String> uniqueColumns,
    @JsonProperty("proposalColumn") String proposalColumn) {

  public static final String ANY_SHEET = "*";

  public SheetRule {
    sheet = sheet == null ? ANY_SHEET : sheet;
    requiredColumns = requiredColumns == null ? List.of() : List.copyOf(requiredColumns);
    numericColumns = numericColumns == null ? List.of() : List.copyOf(numericColumns);
    uniqueColumns = uniqueColumns == null ? List.of() : List.copyOf(uniqueColumns);
  }

  public boolean appliesTo(String sheetName) {
    return ANY_SHEET.equals(sheet) || sheet.equalsIgnoreCase(sheetName);
  }
}
