package com.codeheadsystems.qcheck.server.source;

/**
 * A named external spreadsheet, downloaded as {@code .xlsx} when fetched.
 *
 * @param sheetName the sheet name the user entered
 * @param fetcher   the downloader
 */
public record ExternalSheetSource(String sheetName, ExternalSheetFetcher fetcher) implements SubmissionSource {

  @Override
  public String inputName() {
    return sheetName;
  }

  @Override
  public Submission fetch() {
    byte[] content = fetcher.fetch(sheetName);
    return new Submission(SubmissionKind.EXTERNAL_SHEET, sheetName, sheetName + ".xlsx", content);
  }
}
