package io.mermaidast.flowchart.render;

import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.api.LinkStroke;
import io.mermaidast.flowchart.api.LinkType;

/** Arrow spellings. */
public final class LinkSyntax {

  private LinkSyntax() {}

  /**
   * The arrow alone, e.g. {@code -->}, {@code o==o}, {@code -.-x}. Normal and thick bodies repeat
   * their stroke {@code length + 1} times, or {@code length + 2} times when the arrow is open;
   * dotted bodies are always {@code -.-}.
   */
  public static String arrow(FlowchartLink link) {
    return arrow(link.type(), link.stroke(), link.length());
  }

  public static String arrow(LinkType type, LinkStroke stroke, int length) {
    boolean open = type == LinkType.ARROW_OPEN;
    int len = Math.max(1, length);
    StringBuilder sb = new StringBuilder();
    sb.append(leadIn(type));
    switch (stroke) {
      case NORMAL -> sb.append("-".repeat(open ? len + 2 : len + 1));
      case THICK -> sb.append("=".repeat(open ? len + 2 : len + 1));
      case DOTTED -> sb.append("-.-");
    }
    sb.append(leadOut(type));
    return sb.toString();
  }

  /** Arrow followed by {@code |text|} when the link has text. */
  public static String render(FlowchartLink link) {
    String arrow = arrow(link);
    if (link.text() == null || link.text().isEmpty()) {
      return arrow;
    }
    return arrow + "|" + Labels.quoteIfNeeded(link.text()) + "|";
  }

  private static String leadIn(LinkType type) {
    return switch (type) {
      case ARROW_CIRCLE -> "o";
      case ARROW_CROSS -> "x";
      case ARROW_OPEN, ARROW_POINT -> "";
    };
  }

  private static String leadOut(LinkType type) {
    return switch (type) {
      case ARROW_OPEN -> "";
      case ARROW_POINT -> ">";
      case ARROW_CIRCLE -> "o";
      case ARROW_CROSS -> "x";
    };
  }
}
