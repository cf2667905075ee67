package io.mermaidast.core.api;

/** Exception thrown when an AST breaks an invariant the renderer relies on. */
public final class DiagramRenderException extends RuntimeException {

  public DiagramRenderException(String message) {
    super(message);
  }
}
