package com.codeheadsystems.qcheck.server.report;

import com.codeheadsystems.qcheck.model.Dataset;
import com.codeheadsystems.qcheck.model.Severity;
import com.codeheadsystems.qcheck.model.ValidationMessage;
import com.codeheadsystems.qcheck.model.ValidationReport;
import java.util.List;
import java.util.Optional;

/**
 * Renders the messages of a {@link ValidationReport} as an HTML fragment.
 * <p>
 * Output follows report order: datasets as they were added, then each dataset's
 * messages as they were produced. Messages about a data row carry a one-row excerpt
 * of that row limited to the flagged columns; messages about the header carry the
 * flagged column names. Everything taken from the report is escaped.
 * <p>
 * Stateless: formatting the same report twice gives the same string.
 */
public class ReportFormatter {

  static final String NBSP = "&nbsp;";

  /**
   * Renders every message of one severity.
   *
   * @param report   the report
   * @param severity which messages to render
   * @return the fragment, empty if there are no such messages
   */
  public String format(ValidationReport report, Severity severity) {
    String css = cssClass(severity);
    StringBuilder html = new StringBuilder();
    for (String name : report.datasetNames()) {
      List<ValidationMessage> messages = report.messagesFor(name, severity);
      if (messages.isEmpty()) {
        continue;
      }
      Optional<Dataset> dataset = report.dataset(name);
      html.append("<div class=\"qcheck-dataset\">\n")
          .append("<h3>").append(Html.escape(name)).append("</h3>\n");
      for (ValidationMessage message : messages) {
        appendMessage(html, message, dataset, css);
      }
      html.append("</div>\n");
    }
    return html.toString();
  }

  /**
   * One-line count of errors and warnings.
   *
   * @param report the report
   * @return the fragment
   */
  public String summary(ValidationReport report) {
    return "<p class=\"qcheck-summary\">"
        + plural(report.errorCount(), "error") + ", " + plural(report.warningCount(), "warning")
        + "</p>\n";
  }

  public static String cssClass(Severity severity) {
    return "qcheck-" + severity.label();
  }

  private void appendMessage(StringBuilder html, ValidationMessage message,
                             Optional<Dataset> dataset, String css) {
    if (message.isFileLevel()) {
      paragraph(html, css, message.message());
    } else if (message.isHeaderRow()) {
      paragraph(html, css, "Header: " + message.message());
      if (!message.columns().isEmpty()) {
        html.append("<table class=\"qcheck-excerpt\"><tr>");
        message.columns().forEach(c -> cell(html, "th", css, c));
        html.append("</tr></table>\n");
      }
    } else {
      int row = message.row();
      paragraph(html, css, "Row " + row + ": " + message.message());
      if (dataset.isPresent() && dataset.get().hasRow(row) && !message.columns().isEmpty()) {
        html.append("<table class=\"qcheck-excerpt\"><tr>");
        message.columns().forEach(c -> cell(html, "th", null, c));
        html.append("</tr><tr>");
        for (String column : message.columns()) {
          cell(html, "td", css, dataset.get().cell(row, column).orElse(null));
        }
        html.append("</tr></table>\n");
      }
    }
  }

  private static void paragraph(StringBuilder html, String css, String text) {
    html.append("<p class=\"").append(css).append("\">").append(Html.escape(text)).append("</p>\n");
  }

  private static void cell(StringBuilder html, String tag, String css, String value) {
    html.append('<').append(tag);
    if (css != null) {
      html.append(" class=\"").append(css).append('"');
    }
    html.append('>')
        .append(value == null || value.isEmpty() ? NBSP : Html.escape(value))
        .append("</").append(tag).append('>');
  }

  private static String plural(int count, String noun) {
    return count + " " + noun + (count == 1 ? "" : "s");
  }
}
