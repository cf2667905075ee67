package io.mermaidast.flowchart.api;

/** Node shapes, each with its own bracket syntax. */
public enum NodeShape {
  SQUARE("square"),
  ROUND("round"),
  CIRCLE("circle"),
  DOUBLECIRCLE("doublecircle"),
  ELLIPSE("ellipse"),
  STADIUM("stadium"),
  SUBROUTINE("subroutine"),
  CYLINDER("cylinder"),
  DIAMOND("diamond"),
  HEXAGON("hexagon"),
  ODD("odd"),
  TRAPEZOID("trapezoid"),
  INV_TRAPEZOID("inv_trapezoid"),
  LEAN_RIGHT("lean_right"),
  LEAN_LEFT("lean_left");

  private final String id;

  NodeShape(String id) {
    this.id = id;
  }

  /** Lower-case identifier, e.g. {@code inv_trapezoid}. */
  public String id() {
    return id;
  }

  public static NodeShape fromId(String id) {
    for (NodeShape s : values()) {
      if (s.id.equalsIgnoreCase(id)) {
        return s;
      }
    }
    throw new IllegalArgumentException("Unknown node shape: " + id);
  }
}
