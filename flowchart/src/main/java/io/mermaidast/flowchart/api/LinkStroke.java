package io.mermaidast.flowchart.api;

/** Line style of a link body. */
public enum LinkStroke {
  NORMAL,
  THICK,
  DOTTED
}
