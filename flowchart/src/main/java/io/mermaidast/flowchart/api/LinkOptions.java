package io.mermaidast.flowchart.api;

import java.util.Objects;

/** Styling for links created through {@link Flowchart}. */
public record LinkOptions(LinkType type, LinkStroke stroke, int length, String text) {

  public static final LinkOptions DEFAULT =
      new LinkOptions(LinkType.ARROW_POINT, LinkStroke.NORMAL, 1, null);

  public LinkOptions {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(stroke, "stroke must not be null");
    if (length < 1) {
      throw new IllegalArgumentException("length must be >= 1: " + length);
    }
  }

  public static LinkOptions text(String text) {
    return DEFAULT.withText(text);
  }

  public LinkOptions withType(LinkType type) {
    return new LinkOptions(type, stroke, length, text);
  }

  public LinkOptions withStroke(LinkStroke stroke) {
    return new LinkOptions(type, stroke, length, text);
  }

  public LinkOptions withLength(int length) {
    return new LinkOptions(type, stroke, length, text);
  }

  public LinkOptions withText(String text) {
    return new LinkOptions(type, stroke, length, text);
  }

  FlowchartLink toLink(String source, String target) {
    return new FlowchartLink(source, target, type, stroke, length, text);
  }
}
