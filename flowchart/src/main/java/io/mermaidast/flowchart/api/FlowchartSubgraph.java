package io.mermaidast.flowchart.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A flat subgraph: an id, an optional title and direction, and its ordered member ids. */
public final class FlowchartSubgraph {
  private final String id;
  private String title;
  private FlowchartDirection direction;
  private final List<String> nodes;

  public FlowchartSubgraph(
      String id, String title, FlowchartDirection direction, List<String> nodes) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.title = title;
    this.direction = direction;
    this.nodes = new ArrayList<>(nodes);
  }

  public FlowchartSubgraph(String id) {
    this(id, null, null, List.of());
  }

  public String id() {
    return id;
  }

  /** Explicit title, or {@code null} when the id doubles as the title. */
  public String title() {
    return title;
  }

  public String displayTitle() {
    return title != null ? title : id;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public FlowchartDirection direction() {
    return direction;
  }

  public void setDirection(FlowchartDirection direction) {
    this.direction = direction;
  }

  /** Mutable member list, in declaration order. */
  public List<String> nodes() {
    return nodes;
  }

  public boolean contains(String nodeId) {
    return nodes.contains(nodeId);
  }

  public FlowchartSubgraph copy() {
    return new FlowchartSubgraph(id, title, direction, nodes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowchartSubgraph)) {
      return false;
    }
    FlowchartSubgraph that = (FlowchartSubgraph) o;
    return id.equals(that.id)
        && Objects.equals(title, that.title)
        && direction == that.direction
        && nodes.equals(that.nodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, title, direction, nodes);
  }

  @Override
  public String toString() {
    return "FlowchartSubgraph{id=" + id + ", title=" + title + ", direction=" + direction
        + ", nodes=" + nodes + "}";
  }
}
