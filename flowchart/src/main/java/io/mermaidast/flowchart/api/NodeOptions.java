package io.mermaidast.flowchart.api;

import java.util.List;
import java.util.Objects;

/** Shape and classes for nodes created through {@link Flowchart#addNode}. */
public record NodeOptions(NodeShape shape, List<String> classes) {

  public static final NodeOptions DEFAULT = new NodeOptions(NodeShape.SQUARE, List.of());

  public NodeOptions {
    Objects.requireNonNull(shape, "shape must not be null");
    classes = List.copyOf(classes);
  }

  public static NodeOptions shape(NodeShape shape) {
    return new NodeOptions(shape, List.of());
  }

  public NodeOptions withClasses(String... classes) {
    return new NodeOptions(shape, List.of(classes));
  }
}
