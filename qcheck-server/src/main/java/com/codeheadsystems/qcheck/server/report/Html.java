package com.codeheadsystems.qcheck.server.report;

/**
 * HTML escaping for text placed in element content or quoted attribute values.
 */
public final class Html {

  private Html() {
  }

  public static String escape(String s) {
    if (s == null) {
      return "";
    }
    return s
        .replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;")
        .replace("'", "&#39;");
  }
}
