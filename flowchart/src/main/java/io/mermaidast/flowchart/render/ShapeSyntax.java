package io.mermaidast.flowchart.render;

import io.mermaidast.flowchart.api.FlowchartNode;
import io.mermaidast.flowchart.api.NodeShape;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Bracket pairs of the node shapes. Every shape has its own pair; no two shapes share one. */
public final class ShapeSyntax {

  /** An opening and closing delimiter. */
  public record Brackets(NodeShape shape, String open, String close) {}

  private static final Map<NodeShape, Brackets> BY_SHAPE = new EnumMap<>(NodeShape.class);
  private static final List<Brackets> LONGEST_OPEN_FIRST;

  static {
    for (NodeShape shape : NodeShape.values()) {
      BY_SHAPE.put(shape, brackets(shape));
    }
    List<Brackets> all = new ArrayList<>(BY_SHAPE.values());
    all.sort(Comparator.comparingInt((Brackets b) -> b.open().length()).reversed());
    LONGEST_OPEN_FIRST = List.copyOf(all);
  }

  private ShapeSyntax() {}

  private static Brackets brackets(NodeShape shape) {
    return switch (shape) {
      case SQUARE -> new Brackets(shape, "[", "]");
      case ROUND -> new Brackets(shape, "(", ")");
      case CIRCLE -> new Brackets(shape, "((", "))");
      case DOUBLECIRCLE -> new Brackets(shape, "(((", ")))");
      case ELLIPSE -> new Brackets(shape, "(-", "-)");
      case STADIUM -> new Brackets(shape, "([", "])");
      case SUBROUTINE -> new Brackets(shape, "[[", "]]");
      case CYLINDER -> new Brackets(shape, "[(", ")]");
      case DIAMOND -> new Brackets(shape, "{", "}");
      case HEXAGON -> new Brackets(shape, "{{", "}}");
      case ODD -> new Brackets(shape, ">", "]");
      case TRAPEZOID -> new Brackets(shape, "[/", "\\]");
      case INV_TRAPEZOID -> new Brackets(shape, "[\\", "/]");
      case LEAN_RIGHT -> new Brackets(shape, "[/", "/]");
      case LEAN_LEFT -> new Brackets(shape, "[\\", "\\]");
    };
  }

  public static Brackets of(NodeShape shape) {
    return BY_SHAPE.get(shape);
  }

  /**
   * All bracket pairs, longest opener first. Shapes sharing an opener ({@code [/} and {@code [\})
   * are told apart by their closer.
   */
  public static List<Brackets> longestOpenFirst() {
    return LONGEST_OPEN_FIRST;
  }

  /** {@code [label]} etc., with the label quoted when the bare form would not re-parse. */
  public static String render(FlowchartNode node) {
    Brackets b = BY_SHAPE.get(node.shape());
    return b.open() + Labels.quoteIfNeeded(node.label()) + b.close();
  }
}
