package io.mermaidast.flowchart.api;

import java.util.Objects;

/**
 * A flowchart vertex.
 *
 * @param id unique node id
 * @param shape bracket shape
 * @param text label, or {@code null} to display the id
 */
public record FlowchartNode(String id, NodeShape shape, String text) {

  public FlowchartNode {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(shape, "shape must not be null");
  }

  public FlowchartNode(String id) {
    this(id, NodeShape.SQUARE, null);
  }

  /** The displayed label: {@link #text()} if present, else the id. */
  public String label() {
    return text != null ? text : id;
  }

  public FlowchartNode withText(String text) {
    return new FlowchartNode(id, shape, text);
  }

  public FlowchartNode withShape(NodeShape shape) {
    return new FlowchartNode(id, shape, text);
  }

  /** Characters allowed in a node id, apart from interior dashes. */
  public static boolean isIdChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /** Whether {@code id} is a non-empty run of id characters, with dashes allowed between them. */
  public static boolean isValidId(String id) {
    if (id == null || id.isEmpty()) {
      return false;
    }
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      if (c == '-') {
        if (i == 0 || i == id.length() - 1 || !isIdChar(id.charAt(i + 1))) {
          return false;
        }
      } else if (!isIdChar(c)) {
        return false;
      }
    }
    return true;
  }
}
