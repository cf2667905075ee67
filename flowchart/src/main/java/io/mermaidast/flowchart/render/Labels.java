package io.mermaidast.flowchart.render;

/** Quoting rules for labels, titles and link texts. */
public final class Labels {

  private static final String SPECIAL = "[](){}<>|\"\\/";

  private Labels() {}

  /**
   * Whether {@code text} must be written as a quoted string. Bare text may not contain bracket
   * characters, quotes, slashes, pipes or newlines, may not start or end with whitespace or a
   * dash, and may not be empty.
   */
  public static boolean needsQuotes(String text) {
    if (text.isEmpty()) {
      return true;
    }
    char first = text.charAt(0);
    char last = text.charAt(text.length() - 1);
    if (Character.isWhitespace(first) || Character.isWhitespace(last)) {
      return true;
    }
    if (first == '-' || last == '-') {
      return true;
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\n' || c == '\r' || c == ';' || SPECIAL.indexOf(c) >= 0) {
        return true;
      }
    }
    return false;
  }

  public static String quoteIfNeeded(String text) {
    return needsQuotes(text) ? quote(text) : text;
  }

  /** Double-quoted form; backslash, quote and newline are escaped. */
  public static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
