package io.mermaidast.core.doc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Folds a {@link Doc} into text. Pure and total; the only state is the current indent level. */
public final class DocPrinter {

  private DocPrinter() {}

  public static String print(Doc doc, String indentString) {
    return String.join("\n", lines(doc, indentString));
  }

  /** Rendered lines, without separators. */
  public static List<String> lines(Doc doc, String indentString) {
    Objects.requireNonNull(doc, "doc must not be null");
    Objects.requireNonNull(indentString, "indentString must not be null");
    List<String> out = new ArrayList<>();
    walk(doc, 0, indentString, out);
    return out;
  }

  private static void walk(Doc doc, int level, String indentString, List<String> out) {
    if (doc instanceof Doc.Line line) {
      out.add(indentString.repeat(level) + line.text());
    } else if (doc instanceof Doc.Seq seq) {
      for (Doc child : seq.children()) {
        walk(child, level, indentString, out);
      }
    } else if (doc instanceof Doc.Indent indent) {
      walk(indent.child(), level + 1, indentString, out);
    } else if (doc instanceof Doc.Blank) {
      out.add("");
    }
    // Absent: nothing
  }
}
