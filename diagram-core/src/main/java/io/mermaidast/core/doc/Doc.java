package io.mermaidast.core.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Line-oriented pretty-printing document shared by all diagram renderers.
 *
 * <p>A document is a tree of five variants: a single {@link Line}, a {@link Seq} of children
 * rendered one after another, an {@link Indent} that renders its child one level deeper, a {@link
 * Blank} line and the {@link Absent} document that renders nothing. The indent string is chosen at
 * render time, so the same value prints with spaces or tabs without being rebuilt.
 *
 * <pre>{@code
 * Doc doc =
 *     Doc.seq(
 *         Doc.line("flowchart LR"),
 *         Doc.indent(
 *             Doc.seq(
 *                 Doc.block("subgraph one", Doc.line("A[Start]"), "end"),
 *                 Doc.when(hasLinks, () -> Doc.line("A --> B")))));
 *
 * String text = doc.render("  ");
 * }</pre>
 *
 * <p>No line wrapping is ever performed.
 */
public sealed interface Doc permits Doc.Line, Doc.Seq, Doc.Indent, Doc.Blank, Doc.Absent {

  /** A single line of text printed at the current indent level. */
  record Line(String text) implements Doc {
    public Line {
      Objects.requireNonNull(text, "text must not be null");
    }
  }

  /** Children printed in order at the same indent level. */
  record Seq(List<Doc> children) implements Doc {
    public Seq {
      children = List.copyOf(children);
    }
  }

  /** Child printed one indent level deeper. */
  record Indent(Doc child) implements Doc {
    public Indent {
      Objects.requireNonNull(child, "child must not be null");
    }
  }

  /** An empty line; never indented. */
  enum Blank implements Doc {
    INSTANCE
  }

  /** Prints nothing. Produced by {@link #when} when its condition does not hold. */
  enum Absent implements Doc {
    INSTANCE
  }

  static Doc line(String text) {
    return new Line(text);
  }

  static Doc seq(Doc... children) {
    return new Seq(Arrays.asList(children));
  }

  static Doc seq(List<? extends Doc> children) {
    return new Seq(new ArrayList<>(children));
  }

  /** Convenience for a run of plain lines. */
  static Doc lines(List<String> lines) {
    List<Doc> docs = new ArrayList<>(lines.size());
    for (String l : lines) {
      docs.add(new Line(l));
    }
    return new Seq(docs);
  }

  static Doc indent(Doc child) {
    return new Indent(child);
  }

  static Doc blank() {
    return Blank.INSTANCE;
  }

  static Doc absent() {
    return Absent.INSTANCE;
  }

  static Doc when(boolean condition, Doc doc) {
    return condition ? doc : Absent.INSTANCE;
  }

  /** Lazy variant of {@link #when(boolean, Doc)}; the supplier is only invoked when needed. */
  static Doc when(boolean condition, Supplier<? extends Doc> doc) {
    return condition ? doc.get() : Absent.INSTANCE;
  }

  /** Opening line, indented body, closing line. */
  static Doc block(String open, Doc body, String close) {
    return block(open, body, close, true);
  }

  static Doc block(String open, Doc body, String close, boolean indentBody) {
    return seq(line(open), indentBody ? indent(body) : body, line(close));
  }

  /** Interleaves {@code separator} between the non-absent entries of {@code docs}. */
  static Doc join(List<? extends Doc> docs, Doc separator) {
    List<Doc> out = new ArrayList<>();
    for (Doc d : docs) {
      if (d == null || d == Absent.INSTANCE) {
        continue;
      }
      if (!out.isEmpty()) {
        out.add(separator);
      }
      out.add(d);
    }
    return new Seq(out);
  }

  /**
   * Renders this document, joining lines with {@code '\n'} and without a trailing newline.
   *
   * @param indentString the text emitted once per indent level
   */
  default String render(String indentString) {
    return DocPrinter.print(this, indentString);
  }
}
