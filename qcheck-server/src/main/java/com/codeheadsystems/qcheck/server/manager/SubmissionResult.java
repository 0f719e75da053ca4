package com.codeheadsystems.qcheck.server.manager;

import com.codeheadsystems.qcheck.model.ValidationReport;
import com.codeheadsystems.qcheck.server.content.ContentVerdict;
import com.codeheadsystems.qcheck.server.upload.UploadResult;

/**
 * What happened to one spreadsheet of a request.
 *
 * @param inputName    the file or sheet name the user gave
 * @param fetchFailure why the spreadsheet could not be obtained, null if it was
 * @param verdict      the extension and content verdict, null if not obtained
 * @param report       the validation report, null if content was rejected
 * @param summaryHtml  rendered error and warning counts
 * @param errorsHtml   rendered errors
 * @param warningsHtml rendered warnings
 * @param upload       the upload result, null unless an upload was attempted
 */
public record SubmissionResult(String inputName, String fetchFailure, ContentVerdict verdict,
                               ValidationReport report, String summaryHtml, String errorsHtml,
                               String warningsHtml, UploadResult upload) {

  public static SubmissionResult fetchFailed(String inputName, String reason) {
    return new SubmissionResult(inputName, reason, null, null, "", "", "", null);
  }

  public static SubmissionResult contentRejected(String inputName, ContentVerdict verdict) {
    return new SubmissionResult(inputName, null, verdict, null, "", "", "", null);
  }
}
