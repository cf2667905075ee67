package io.mermaidast.flowchart.analysis;

import io.mermaidast.flowchart.api.FlowchartAst;
import io.mermaidast.flowchart.api.FlowchartLink;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only traversals over the links of a flowchart.
 *
 * <p>All traversals follow links in stored order, so results are deterministic for a given AST.
 * Node ids are not checked against the node map: a start id with no links simply yields itself.
 *
 * <p><strong>Performance:</strong> O(V + E) per query; adjacency is rebuilt on every call.
 */
public final class GraphQueries {

  private GraphQueries() {}

  /**
   * Nodes reachable from {@code start} by following links forward, in breadth-first order.
   * Includes {@code start}.
   */
  public static List<String> reachable(FlowchartAst ast, String start) {
    return bfs(start, adjacency(ast.links(), true));
  }

  /** Nodes that can reach {@code target}, in breadth-first order over reversed links. */
  public static List<String> ancestors(FlowchartAst ast, String target) {
    return bfs(target, adjacency(ast.links(), false));
  }

  /**
   * Finds the shortest path from {@code source} to {@code target}.
   *
   * <p>Of several shortest paths the first one discovered in link order wins. If the two ids are
   * equal the path is that single node.
   *
   * @return the node sequence including both ends, or an empty list if unreachable
   */
  public static List<String> shortestPath(FlowchartAst ast, String source, String target) {
    if (source.equals(target)) {
      return List.of(source);
    }
    Map<String, List<String>> forward = adjacency(ast.links(), true);

    // BFS tracking the node each one was first reached from
    Map<String, String> parents = new HashMap<>();
    Set<String> visited = new LinkedHashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    visited.add(source);
    queue.add(source);

    boolean found = false;
    while (!queue.isEmpty() && !found) {
      String current = queue.poll();
      for (String next : forward.getOrDefault(current, List.of())) {
        if (visited.add(next)) {
          parents.put(next, current);
          if (next.equals(target)) {
            found = true;
            break;
          }
          queue.add(next);
        }
      }
    }
    if (!found) {
      return List.of();
    }

    List<String> path = new ArrayList<>();
    String current = target;
    while (current != null) {
      path.add(current);
      current = parents.get(current);
    }
    Collections.reverse(path);
    return path;
  }

  /**
   * Walks forward from {@code start} while each node has exactly one outgoing link.
   *
   * @return the full node sequence if the walk arrives at {@code end}, otherwise an empty list.
   *     The walk gives up once it is longer than the number of nodes, which also stops cycles.
   */
  public static List<String> linearChain(FlowchartAst ast, String start, String end) {
    if (start.equals(end)) {
      return List.of(start);
    }
    Map<String, List<String>> forward = adjacency(ast.links(), true);
    List<String> chain = new ArrayList<>();
    chain.add(start);
    String current = start;
    while (!current.equals(end)) {
      List<String> out = forward.getOrDefault(current, List.of());
      if (out.size() != 1) {
        return List.of();
      }
      current = out.get(0);
      chain.add(current);
      if (chain.size() > ast.nodes().size()) {
        return List.of();
      }
    }
    return chain;
  }

  /** Outgoing (or incoming) neighbours per node, one entry per link so parallel links count. */
  static Map<String, List<String>> adjacency(List<FlowchartLink> links, boolean forward) {
    Map<String, List<String>> adj = new LinkedHashMap<>();
    for (FlowchartLink link : links) {
      String from = forward ? link.source() : link.target();
      String to = forward ? link.target() : link.source();
      adj.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
    }
    return adj;
  }

  private static List<String> bfs(String start, Map<String, List<String>> adj) {
    Set<String> visited = new LinkedHashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    visited.add(start);
    queue.add(start);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      for (String next : adj.getOrDefault(current, List.of())) {
        if (visited.add(next)) {
          queue.add(next);
        }
      }
    }
    return new ArrayList<>(visited);
  }
}
