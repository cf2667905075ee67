package io.mermaidast.core.render;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Options controlling how a diagram AST is printed.
 *
 * <p>{@code indent} is the literal text emitted once per nesting level: a run of spaces or a
 * single tab. The three flags select between equivalent spellings of the same diagram; none of
 * them changes what a re-parse of the output produces.
 *
 * @param indent text emitted per indent level, empty for flat output
 * @param sortNodes print nodes in lexicographic id order instead of insertion order
 * @param inlineClasses attach classes to node declarations ({@code A[x]:::cls}) instead of
 *     separate {@code class} statements
 * @param compactLinks merge single-in/single-out runs of links into one printed chain
 */
public record RenderOptions(
    String indent, boolean sortNodes, boolean inlineClasses, boolean compactLinks) {

  public static final String TAB = "tab";
  public static final int DEFAULT_INDENT = 4;

  public static final RenderOptions DEFAULT = builder().build();

  public RenderOptions {
    Objects.requireNonNull(indent, "indent must not be null");
    if (!indent.equals("\t") && !indent.chars().allMatch(c -> c == ' ')) {
      throw new IllegalArgumentException("indent must be spaces or a single tab: '" + indent + "'");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.indent = indent;
    b.sortNodes = sortNodes;
    b.inlineClasses = inlineClasses;
    b.compactLinks = compactLinks;
    return b;
  }

  /** Whether indentation uses a tab character. */
  public boolean usesTab() {
    return indent.equals("\t");
  }

  /**
   * Reads options from properties. Recognised keys are {@code indent} ({@code tab} or a
   * non-negative integer), {@code sortNodes}, {@code inlineClasses} and {@code compactLinks}.
   * Missing keys keep their defaults.
   *
   * @throws IllegalArgumentException if {@code indent} is neither {@code tab} nor a non-negative
   *     integer
   */
  public static RenderOptions fromProperties(Properties props) {
    Builder b = builder();
    String indent = props.getProperty("indent");
    if (indent != null) {
      indent = indent.trim();
      if (indent.equalsIgnoreCase(TAB)) {
        b.indentTab();
      } else {
        try {
          b.indent(Integer.parseInt(indent));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Invalid indent value: '" + indent + "'", e);
        }
      }
    }
    b.sortNodes(Boolean.parseBoolean(props.getProperty("sortNodes", "false").trim()));
    b.inlineClasses(Boolean.parseBoolean(props.getProperty("inlineClasses", "false").trim()));
    b.compactLinks(Boolean.parseBoolean(props.getProperty("compactLinks", "false").trim()));
    return b.build();
  }

  public Properties toProperties() {
    Properties props = new Properties();
    props.setProperty("indent", usesTab() ? TAB : String.valueOf(indent.length()));
    props.setProperty("sortNodes", String.valueOf(sortNodes));
    props.setProperty("inlineClasses", String.valueOf(inlineClasses));
    props.setProperty("compactLinks", String.valueOf(compactLinks));
    return props;
  }

  /**
   * Loads options from a {@code .properties} file.
   *
   * @return the parsed options, or {@link #DEFAULT} if the file does not exist
   * @throws IOException if the file exists but cannot be read
   */
  public static RenderOptions load(Path path) throws IOException {
    if (!Files.exists(path)) {
      return DEFAULT;
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  public static final class Builder {
    private String indent = " ".repeat(DEFAULT_INDENT);
    private boolean sortNodes;
    private boolean inlineClasses;
    private boolean compactLinks;

    private Builder() {}

    /** Indents with {@code spaces} spaces per level; {@code 0} yields flat output. */
    public Builder indent(int spaces) {
      if (spaces < 0) {
        throw new IllegalArgumentException("indent must be >= 0: " + spaces);
      }
      this.indent = " ".repeat(spaces);
      return this;
    }

    public Builder indentTab() {
      this.indent = "\t";
      return this;
    }

    public Builder sortNodes(boolean sortNodes) {
      this.sortNodes = sortNodes;
      return this;
    }

    public Builder inlineClasses(boolean inlineClasses) {
      this.inlineClasses = inlineClasses;
      return this;
    }

    public Builder compactLinks(boolean compactLinks) {
      this.compactLinks = compactLinks;
      return this;
    }

    public RenderOptions build() {
      return new RenderOptions(indent, sortNodes, inlineClasses, compactLinks);
    }
  }
}
