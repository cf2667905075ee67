package io.mermaidast.core.api;

/**
 * Exception thrown when diagram source text violates the grammar.
 *
 * <p>Line and column are 1-based. The fragment is a short excerpt of the source starting at the
 * offending position.
 */
public final class DiagramParseException extends RuntimeException {

  private final int line;
  private final int column;
  private final String fragment;

  public DiagramParseException(String reason, int line, int column, String fragment) {
    super(reason + " at line " + line + ", column " + column + ": " + fragment);
    this.line = line;
    this.column = column;
    this.fragment = fragment;
  }

  public DiagramParseException(String message) {
    super(message);
    this.line = -1;
    this.column = -1;
    this.fragment = "";
  }

  /** 1-based line number, or -1 when unknown. */
  public int line() {
    return line;
  }

  /** 1-based column number, or -1 when unknown. */
  public int column() {
    return column;
  }

  public String fragment() {
    return fragment;
  }
}
