package io.mermaidast.flowchart.api;

import java.util.regex.Pattern;

/**
 * Criteria for {@link Flowchart#findNodes}. Every non-null criterion must match.
 *
 * @param textContains substring of the label (the id when the node has no text)
 * @param textMatches pattern searched for in the label
 * @param inSubgraph id of the subgraph the node must belong to
 */
public record NodeQuery(
    String className,
    NodeShape shape,
    String textContains,
    Pattern textMatches,
    String inSubgraph) {

  public static final NodeQuery ALL = new NodeQuery(null, null, null, null, null);

  public static NodeQuery withClass(String className) {
    return ALL.className(className);
  }

  public static NodeQuery withShape(NodeShape shape) {
    return ALL.shape(shape);
  }

  public NodeQuery className(String className) {
    return new NodeQuery(className, shape, textContains, textMatches, inSubgraph);
  }

  public NodeQuery shape(NodeShape shape) {
    return new NodeQuery(className, shape, textContains, textMatches, inSubgraph);
  }

  public NodeQuery textContains(String text) {
    return new NodeQuery(className, shape, text, textMatches, inSubgraph);
  }

  public NodeQuery textMatches(String regex) {
    return new NodeQuery(className, shape, textContains, Pattern.compile(regex), inSubgraph);
  }

  public NodeQuery inSubgraph(String subgraphId) {
    return new NodeQuery(className, shape, textContains, textMatches, subgraphId);
  }
}
