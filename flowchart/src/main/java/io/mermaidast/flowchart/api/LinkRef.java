package io.mermaidast.flowchart.api;

/** A link together with its position in the link list. */
public record LinkRef(int index, FlowchartLink link) {}
