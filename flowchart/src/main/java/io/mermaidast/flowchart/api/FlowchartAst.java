package io.mermaidast.flowchart.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory representation of one flowchart.
 *
 * <p>All collections are mutable and preserve insertion order, which the renderer relies on for
 * deterministic output. The AST is not thread-safe; callers own it exclusively.
 */
public final class FlowchartAst {
  private FlowchartDirection direction;
  private final Map<String, FlowchartNode> nodes = new LinkedHashMap<>();
  private final List<FlowchartLink> links = new ArrayList<>();
  private final List<FlowchartSubgraph> subgraphs = new ArrayList<>();
  private final Map<String, FlowchartClassDef> classDefs = new LinkedHashMap<>();
  private final Map<String, List<String>> classes = new LinkedHashMap<>();
  private final Map<String, Map<String, String>> nodeStyles = new LinkedHashMap<>();
  private final List<FlowchartClick> clicks = new ArrayList<>();
  private final List<FlowchartLinkStyle> linkStyles = new ArrayList<>();
  private String title;
  private String accDescription;

  public FlowchartAst(FlowchartDirection direction) {
    this.direction = Objects.requireNonNull(direction, "direction must not be null");
  }

  public FlowchartAst() {
    this(FlowchartDirection.TD);
  }

  public FlowchartDirection direction() {
    return direction;
  }

  public void setDirection(FlowchartDirection direction) {
    this.direction = Objects.requireNonNull(direction, "direction must not be null");
  }

  public Map<String, FlowchartNode> nodes() {
    return nodes;
  }

  public List<FlowchartLink> links() {
    return links;
  }

  public List<FlowchartSubgraph> subgraphs() {
    return subgraphs;
  }

  public Map<String, FlowchartClassDef> classDefs() {
    return classDefs;
  }

  /** Node id to ordered class names. */
  public Map<String, List<String>> classes() {
    return classes;
  }

  /** Node id to {@code style} properties. */
  public Map<String, Map<String, String>> nodeStyles() {
    return nodeStyles;
  }

  public List<FlowchartClick> clicks() {
    return clicks;
  }

  public List<FlowchartLinkStyle> linkStyles() {
    return linkStyles;
  }

  public String title() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String accDescription() {
    return accDescription;
  }

  public void setAccDescription(String accDescription) {
    this.accDescription = accDescription;
  }

  /** Deep copy; no collection is shared with this instance. */
  public FlowchartAst copy() {
    FlowchartAst c = new FlowchartAst(direction);
    c.nodes.putAll(nodes);
    c.links.addAll(links);
    for (FlowchartSubgraph sg : subgraphs) {
      c.subgraphs.add(sg.copy());
    }
    for (FlowchartClassDef def : classDefs.values()) {
      c.classDefs.put(def.name(), new FlowchartClassDef(def.name(), def.styles()));
    }
    classes.forEach((id, names) -> c.classes.put(id, new ArrayList<>(names)));
    nodeStyles.forEach((id, styles) -> c.nodeStyles.put(id, new LinkedHashMap<>(styles)));
    c.clicks.addAll(clicks);
    for (FlowchartLinkStyle ls : linkStyles) {
      c.linkStyles.add(new FlowchartLinkStyle(ls.index(), ls.styles(), ls.interpolate()));
    }
    c.title = title;
    c.accDescription = accDescription;
    return c;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowchartAst)) {
      return false;
    }
    FlowchartAst that = (FlowchartAst) o;
    return direction == that.direction
        && nodes.equals(that.nodes)
        && links.equals(that.links)
        && subgraphs.equals(that.subgraphs)
        && classDefs.equals(that.classDefs)
        && classes.equals(that.classes)
        && nodeStyles.equals(that.nodeStyles)
        && clicks.equals(that.clicks)
        && linkStyles.equals(that.linkStyles)
        && Objects.equals(title, that.title)
        && Objects.equals(accDescription, that.accDescription);
  }

  @Override
  public int hashCode() {
    return Objects.hash(direction, nodes, links, subgraphs, classDefs, classes);
  }

  @Override
  public String toString() {
    return "FlowchartAst{direction=" + direction + ", nodes=" + nodes.size() + ", links="
        + links.size() + ", subgraphs=" + subgraphs.size() + "}";
  }
}
