package io.mermaidast.flowchart;

import static org.junit.jupiter.api.Assertions.*;

import io.mermaidast.flowchart.api.FlowchartAst;
import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.api.FlowchartNode;
import io.mermaidast.flowchart.api.FlowchartSubgraph;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Semantic comparison of flowchart ASTs, ignoring spelling-only differences. */
public final class AstAssertions {

  private AstAssertions() {}

  /** Link identity for multiset comparison; length only affects spelling. */
  public record LinkKey(String source, String target, String type, String stroke, String text) {
    static LinkKey of(FlowchartLink l) {
      return new LinkKey(l.source(), l.target(), l.type().name(), l.stroke().name(), l.text());
    }
  }

  public static void assertEquivalent(FlowchartAst expected, FlowchartAst actual) {
    assertEquals(expected.direction(), actual.direction(), "direction");
    assertEquals(nodeSummary(expected), nodeSummary(actual), "nodes");
    assertEquals(linkMultiset(expected.links()), linkMultiset(actual.links()), "links");
    assertEquals(subgraphSummary(expected), subgraphSummary(actual), "subgraphs");
  }

  public static Map<String, String> nodeSummary(FlowchartAst ast) {
    Map<String, String> out = new HashMap<>();
    for (FlowchartNode n : ast.nodes().values()) {
      out.put(n.id(), n.shape().id() + ":" + n.label());
    }
    return out;
  }

  public static Map<LinkKey, Integer> linkMultiset(List<FlowchartLink> links) {
    Map<LinkKey, Integer> out = new HashMap<>();
    for (FlowchartLink l : links) {
      out.merge(LinkKey.of(l), 1, Integer::sum);
    }
    return out;
  }

  /** Subgraph id to (display title, direction, member set). */
  public static Map<String, List<Object>> subgraphSummary(FlowchartAst ast) {
    Map<String, List<Object>> out = new HashMap<>();
    for (FlowchartSubgraph sg : ast.subgraphs()) {
      Set<String> members = new HashSet<>(sg.nodes());
      out.put(
          sg.id(),
          List.of(sg.displayTitle(), String.valueOf(sg.direction()), members));
    }
    return out;
  }
}
