package io.mermaidast.flowchart.api;

import java.util.Objects;

/**
 * A directed edge between two node ids.
 *
 * @param length visual length of the arrow body, at least 1
 * @param text inline label, or {@code null}
 */
public record FlowchartLink(
    String source, String target, LinkType type, LinkStroke stroke, int length, String text) {

  public FlowchartLink {
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(target, "target must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(stroke, "stroke must not be null");
    if (length < 1) {
      throw new IllegalArgumentException("length must be >= 1: " + length);
    }
  }

  /** A plain {@code source --> target} link. */
  public static FlowchartLink of(String source, String target) {
    return new FlowchartLink(source, target, LinkType.ARROW_POINT, LinkStroke.NORMAL, 1, null);
  }

  public FlowchartLink withSource(String source) {
    return new FlowchartLink(source, target, type, stroke, length, text);
  }

  public FlowchartLink withTarget(String target) {
    return new FlowchartLink(source, target, type, stroke, length, text);
  }

  public FlowchartLink withType(LinkType type) {
    return new FlowchartLink(source, target, type, stroke, length, text);
  }

  public FlowchartLink withStroke(LinkStroke stroke) {
    return new FlowchartLink(source, target, type, stroke, length, text);
  }

  public FlowchartLink withText(String text) {
    return new FlowchartLink(source, target, type, stroke, length, text);
  }

  /** Same link with source and target swapped. */
  public FlowchartLink reversed() {
    return new FlowchartLink(target, source, type, stroke, length, text);
  }

  public boolean connects(String a, String b) {
    return source.equals(a) && target.equals(b);
  }

  public boolean touches(String nodeId) {
    return source.equals(nodeId) || target.equals(nodeId);
  }
}
