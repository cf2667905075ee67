package io.mermaidast.flowchart.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@code linkStyle} statement for one link index, or for all links when {@link #isDefault()}.
 *
 * @param index link index, or {@link #DEFAULT_INDEX}
 * @param interpolate curve name, or {@code null}
 */
public record FlowchartLinkStyle(int index, Map<String, String> styles, String interpolate) {

  public static final int DEFAULT_INDEX = -1;

  public FlowchartLinkStyle {
    if (index < DEFAULT_INDEX) {
      throw new IllegalArgumentException("invalid link index: " + index);
    }
    styles = new LinkedHashMap<>(styles);
  }

  public boolean isDefault() {
    return index == DEFAULT_INDEX;
  }
}
