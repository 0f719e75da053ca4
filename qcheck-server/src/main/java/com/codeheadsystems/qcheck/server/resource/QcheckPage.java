package com.codeheadsystems.qcheck.server.resource;

import com.codeheadsystems.qcheck.server.content.ContentVerdict;
import com.codeheadsystems.qcheck.server.manager.RequestOutcome;
import com.codeheadsystems.qcheck.server.manager.SubmissionResult;
import com.codeheadsystems.qcheck.server.report.Html;
import com.codeheadsystems.qcheck.server.session.Session;
import com.codeheadsystems.qcheck.server.upload.StoredUpload;
import java.util.List;

/**
 * Minimal HTML page for the check/upload form and its results.
 */
public class QcheckPage {

  private final List<String> allowedExtensions;

  public QcheckPage(List<String> allowedExtensions) {
    this.allowedExtensions = List.copyOf(allowedExtensions);
  }

  /**
   * The page with no results, as shown on GET.
   *
   * @param session the current session, null if not logged in
   * @return the page
   */
  public String render(Session session) {
    StringBuilder body = new StringBuilder();
    form(body, session, null);
    return page(body);
  }

  /**
   * The page after a POST.
   *
   * @param outcome the outcome
   * @return the page
   */
  public String render(RequestOutcome outcome) {
    StringBuilder body = new StringBuilder();
    if (outcome.notice() != null) {
      body.append("<p class=\"qcheck-notice\">").append(Html.escape(outcome.notice())).append("</p>\n");
    }
    if (outcome.storedFiles() != null) {
      storedFiles(body, outcome.storedFiles());
    }
    for (SubmissionResult result : outcome.submissions()) {
      submission(body, result);
    }
    form(body, outcome.session(), outcome.proposalId());
    return page(body);
  }

  /**
   * The page for a request that could not be handled.
   *
   * @param message the reason, shown escaped
   * @return the page
   */
  public String error(String message) {
    StringBuilder body = new StringBuilder();
    body.append("<p class=\"qcheck-error\">").append(Html.escape(message)).append("</p>\n");
    return page(body);
  }

  private void submission(StringBuilder body, SubmissionResult result) {
    body.append("<h2>").append(Html.escape(result.inputName())).append("</h2>\n");
    if (result.fetchFailure() != null) {
      body.append("<p class=\"qcheck-error\">").append(Html.escape(result.fetchFailure())).append("</p>\n");
      return;
    }
    ContentVerdict verdict = result.verdict();
    if (!verdict.accepted()) {
      verdict.rejections().forEach(r ->
          body.append("<p class=\"qcheck-error\">").append(Html.escape(r)).append("</p>\n"));
      return;
    }
    body.append(result.summaryHtml()).append(result.errorsHtml()).append(result.warningsHtml());
    if (result.upload() != null) {
      body.append("<p class=\"qcheck-upload-").append(result.upload().status().label()).append("\">")
          .append(Html.escape(result.upload().message())).append("</p>\n");
    }
  }

  private static void storedFiles(StringBuilder body, List<StoredUpload> files) {
    body.append("<table class=\"qcheck-files\"><tr><th>File</th><th>Size</th><th>Modified</th></tr>\n");
    for (StoredUpload file : files) {
      body.append("<tr><td>").append(Html.escape(file.name()))
          .append("</td><td>").append(file.size())
          .append("</td><td>").append(file.lastModified())
          .append("</td></tr>\n");
    }
    body.append("</table>\n");
  }

  private void form(StringBuilder body, Session session, String proposalId) {
    body.append("<form method=\"post\" enctype=\"multipart/form-data\">\n");
    if (session == null) {
      body.append("<p>Username <input name=\"username\"/> Password <input type=\"password\" name=\"password\"/>")
          .append(" <button name=\"action\" value=\"login\">Log in</button></p>\n");
    } else {
      body.append("<p>Logged in as ").append(Html.escape(session.displayName()))
          .append(" (").append(Html.escape(session.backend())).append(")")
          .append(" <button name=\"action\" value=\"logout\">Log out</button></p>\n");
    }
    body.append("<p>Proposal <input name=\"proposal\" value=\"").append(Html.escape(proposalId)).append("\"/></p>\n")
        .append("<p>File (").append(Html.escape(String.join(", ", allowedExtensions)))
        .append(") <input type=\"file\" name=\"file\" multiple/> or sheet <input name=\"sheet_name\"/></p>\n")
        .append("<p><button name=\"action\" value=\"check\">Check</button>")
        .append(" <button name=\"action\" value=\"upload\">Upload</button>")
        .append(" <button name=\"action\" value=\"list_files\">List files</button></p>\n")
        .append("</form>\n");
  }

  private static String page(StringBuilder body) {
    return "<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"/><title>Queue file check</title>\n"
        + "<style>.qcheck-error{color:#b00}.qcheck-warning{color:#b60}</style></head>\n<body>\n"
        + "<h1>Queue file check</h1>\n" + body + "</body></html>\n";
  }
}
