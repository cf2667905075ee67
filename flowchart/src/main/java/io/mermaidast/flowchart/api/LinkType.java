package io.mermaidast.flowchart.api;

/** Arrow head of a link. */
public enum LinkType {
  /** No head: {@code A --- B}. */
  ARROW_OPEN,
  /** {@code A --> B}. */
  ARROW_POINT,
  /** {@code A --o B}. */
  ARROW_CIRCLE,
  /** {@code A --x B}. */
  ARROW_CROSS
}
