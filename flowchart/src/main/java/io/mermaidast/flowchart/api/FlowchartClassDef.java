package io.mermaidast.flowchart.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A {@code classDef} statement: a named, ordered set of style properties. */
public record FlowchartClassDef(String name, Map<String, String> styles) {

  public FlowchartClassDef {
    Objects.requireNonNull(name, "name must not be null");
    styles = new LinkedHashMap<>(styles);
  }
}
