package io.mermaidast.flowchart.impl;

import io.mermaidast.flowchart.api.FlowchartAst;
import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.api.FlowchartNode;
import io.mermaidast.flowchart.api.FlowchartSubgraph;
import io.mermaidast.flowchart.api.NodeShape;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural edits on a {@link FlowchartAst}: node removal with reconnection, and the chain
 * operations built on it.
 *
 * <p>Operations mutate the AST in place. Ids that do not exist are ignored.
 */
public final class ChainSurgery {
  private static final Logger LOG = LoggerFactory.getLogger(ChainSurgery.class);

  private ChainSurgery() {}

  /**
   * Removes a node, every link touching it, its subgraph membership, classes, style and clicks.
   *
   * <p>With {@code reconnect}, each incoming source is first linked to each outgoing target,
   * skipping pairs that would form a self-loop. New links copy type, stroke and length from the
   * incoming link and carry no text.
   */
  public static void removeNode(FlowchartAst ast, String id, boolean reconnect) {
    if (!ast.nodes().containsKey(id)) {
      return;
    }
    int added = 0;
    if (reconnect) {
      List<FlowchartLink> incoming = new ArrayList<>();
      List<FlowchartLink> outgoing = new ArrayList<>();
      for (FlowchartLink link : ast.links()) {
        if (link.target().equals(id)) {
          incoming.add(link);
        }
        if (link.source().equals(id)) {
          outgoing.add(link);
        }
      }
      added = bridge(ast, incoming, outgoing);
    }
    ast.links().removeIf(l -> l.touches(id));
    for (FlowchartSubgraph sg : ast.subgraphs()) {
      sg.nodes().remove(id);
    }
    ast.classes().remove(id);
    ast.nodeStyles().remove(id);
    ast.clicks().removeIf(c -> c.nodeId().equals(id));
    ast.nodes().remove(id);
    LOG.debug("Removed node '{}' (reconnect={}, {} links added)", id, reconnect, added);
  }

  /**
   * Places {@code newId} on the first {@code source -> target} link. The link is replaced by
   * {@code source -> newId}, which keeps its text, and {@code newId -> target}, which does not.
   * Both copy type, stroke and length. Without such a link two default links are added.
   */
  public static void insertBetween(
      FlowchartAst ast, String newId, String source, String target, String text) {
    int index = indexOfLink(ast, source, target);
    ast.nodes().put(newId, new FlowchartNode(newId, NodeShape.SQUARE, emptyToNull(text)));
    if (index < 0) {
      ast.links().add(FlowchartLink.of(source, newId));
      ast.links().add(FlowchartLink.of(newId, target));
      LOG.debug("Inserted '{}' between unlinked '{}' and '{}'", newId, source, target);
      return;
    }
    FlowchartLink original = ast.links().get(index);
    ast.links().add(original.withTarget(newId));
    ast.links().add(original.withSource(newId).withText(null));
    ast.links().remove(index);
    LOG.debug("Inserted '{}' on link {} ({} -> {})", newId, index, source, target);
  }

  /**
   * Removes the nodes of {@code ids} and links every outside source pointing at the first node to
   * every outside target of the last node. Self-loops are not created.
   */
  public static void yankChain(FlowchartAst ast, List<String> ids) {
    if (ids.isEmpty()) {
      return;
    }
    Set<String> members = new HashSet<>(ids);
    String first = ids.get(0);
    String last = ids.get(ids.size() - 1);
    List<FlowchartLink> incoming = new ArrayList<>();
    List<FlowchartLink> outgoing = new ArrayList<>();
    for (FlowchartLink link : ast.links()) {
      if (link.target().equals(first) && !members.contains(link.source())) {
        incoming.add(link);
      }
      if (link.source().equals(last) && !members.contains(link.target())) {
        outgoing.add(link);
      }
    }
    int added = bridge(ast, incoming, outgoing);
    for (String id : ids) {
      removeNode(ast, id, false);
    }
    LOG.debug("Yanked chain {} ({} links added)", ids, added);
  }

  /**
   * Links {@code source} to the first node of {@code ids} and the last node to {@code target},
   * after removing direct links between the two. Links among {@code ids} are left alone. With an
   * empty chain a single {@code source -> target} link is added.
   */
  public static void spliceChain(
      FlowchartAst ast, List<String> ids, String source, String target, FlowchartLink template) {
    if (ids.isEmpty()) {
      ast.links().add(template.withSource(source).withTarget(target));
      return;
    }
    int removed = removeLinksBetween(ast, source, target);
    ast.links().add(template.withSource(source).withTarget(ids.get(0)));
    ast.links().add(template.withSource(ids.get(ids.size() - 1)).withTarget(target));
    LOG.debug("Spliced {} between '{}' and '{}' ({} links replaced)", ids, source, target, removed);
  }

  /** Flips the first link found between each consecutive pair of {@code ids}. */
  public static void reverseChain(FlowchartAst ast, List<String> ids) {
    int flipped = 0;
    for (int i = 0; i + 1 < ids.size(); i++) {
      int index = indexOfLink(ast, ids.get(i), ids.get(i + 1));
      if (index >= 0) {
        ast.links().set(index, ast.links().get(index).reversed());
        flipped++;
      }
    }
    LOG.debug("Reversed chain {} ({} links flipped)", ids, flipped);
  }

  /**
   * Copies the nodes of {@code ids}, their classes and the links among them into a new AST with
   * the same direction, then yanks the chain from {@code ast}.
   */
  public static FlowchartAst extractChain(FlowchartAst ast, List<String> ids) {
    FlowchartAst extracted = new FlowchartAst(ast.direction());
    Set<String> members = new HashSet<>(ids);
    for (String id : ids) {
      FlowchartNode node = ast.nodes().get(id);
      if (node == null) {
        continue;
      }
      extracted.nodes().put(id, node);
      List<String> classes = ast.classes().get(id);
      if (classes != null && !classes.isEmpty()) {
        extracted.classes().put(id, new ArrayList<>(classes));
      }
    }
    for (FlowchartLink link : ast.links()) {
      if (members.contains(link.source()) && members.contains(link.target())) {
        extracted.links().add(link);
      }
    }
    yankChain(ast, ids);
    return extracted;
  }

  /**
   * Detaches {@code ids} from everything outside them and hangs their roots under {@code
   * newParent}. A root is a member with no incoming link from another member.
   */
  public static void rebaseNodes(FlowchartAst ast, List<String> ids, String newParent) {
    if (ids.isEmpty()) {
      return;
    }
    Set<String> members = new HashSet<>(ids);
    ast.links().removeIf(l -> !members.contains(l.source()) && members.contains(l.target()));
    List<String> roots = new ArrayList<>();
    for (String id : ids) {
      boolean hasMemberParent = false;
      for (FlowchartLink link : ast.links()) {
        if (link.target().equals(id) && members.contains(link.source())) {
          hasMemberParent = true;
          break;
        }
      }
      if (!hasMemberParent) {
        roots.add(id);
      }
    }
    for (String root : roots) {
      ast.links().add(FlowchartLink.of(newParent, root));
    }
    LOG.debug("Rebased {} under '{}' (roots {})", ids, newParent, roots);
  }

  /** Removes every {@code source -> target} link; returns how many were removed. */
  public static int removeLinksBetween(FlowchartAst ast, String source, String target) {
    int before = ast.links().size();
    ast.links().removeIf(l -> l.connects(source, target));
    return before - ast.links().size();
  }

  public static int indexOfLink(FlowchartAst ast, String source, String target) {
    for (int i = 0; i < ast.links().size(); i++) {
      if (ast.links().get(i).connects(source, target)) {
        return i;
      }
    }
    return -1;
  }

  private static int bridge(
      FlowchartAst ast, List<FlowchartLink> incoming, List<FlowchartLink> outgoing) {
    int added = 0;
    for (FlowchartLink in : incoming) {
      for (FlowchartLink out : outgoing) {
        if (!in.source().equals(out.target())) {
          ast.links()
              .add(
                  new FlowchartLink(
                      in.source(), out.target(), in.type(), in.stroke(), in.length(), null));
          added++;
        }
      }
    }
    return added;
  }

  private static String emptyToNull(String text) {
    return text == null || text.isEmpty() ? null : text;
  }
}
