package io.mermaidast.flowchart.render;

import io.mermaidast.flowchart.api.FlowchartLink;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups links into printable chains such as {@code A --> B --> C}.
 *
 * <p>A chain is extended from a node only while that node has exactly one outgoing link left. A
 * hop whose target has more than one incoming link is still taken but ends the chain, so a joined
 * node is never swallowed into the middle of a line.
 */
public final class ChainCompactor {
  private static final Logger LOG = LoggerFactory.getLogger(ChainCompactor.class);

  /**
   * A run of links printed on one line.
   *
   * @param nodeIds the nodes in print order; one more than {@code linkIndices}
   * @param linkIndices indices into the link list, one per hop
   */
  public record Chain(List<String> nodeIds, List<Integer> linkIndices) {
    public Chain {
      nodeIds = List.copyOf(nodeIds);
      linkIndices = List.copyOf(linkIndices);
    }
  }

  private record Edge(String target, int index) {}

  private ChainCompactor() {}

  /**
   * Builds chains over the links not contained in {@code excluded}. A link belongs to at most one
   * chain; links leaving a branching node belong to none.
   */
  public static List<Chain> buildChains(List<FlowchartLink> links, Set<Integer> excluded) {
    Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
    Map<String, Integer> incoming = new HashMap<>();
    for (int i = 0; i < links.size(); i++) {
      if (excluded.contains(i)) {
        continue;
      }
      FlowchartLink link = links.get(i);
      outgoing
          .computeIfAbsent(link.source(), k -> new ArrayList<>())
          .add(new Edge(link.target(), i));
      incoming.merge(link.target(), 1, Integer::sum);
    }

    List<Chain> chains = new ArrayList<>();
    Set<Integer> visited = new HashSet<>();
    for (int i = 0; i < links.size(); i++) {
      if (excluded.contains(i) || visited.contains(i)) {
        continue;
      }
      String current = links.get(i).source();
      List<String> nodeIds = new ArrayList<>();
      List<Integer> linkIndices = new ArrayList<>();
      nodeIds.add(current);
      while (true) {
        List<Edge> edges = outgoing.get(current);
        if (edges == null || edges.size() != 1) {
          break;
        }
        Edge edge = edges.get(0);
        if (!visited.add(edge.index())) {
          break;
        }
        nodeIds.add(edge.target());
        linkIndices.add(edge.index());
        if (incoming.getOrDefault(edge.target(), 0) != 1) {
          break;
        }
        current = edge.target();
      }
      if (!linkIndices.isEmpty()) {
        LOG.trace("Chain {} via links {}", nodeIds, linkIndices);
        chains.add(new Chain(nodeIds, linkIndices));
      }
    }
    return chains;
  }
}
