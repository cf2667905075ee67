package io.mermaidast.flowchart.api;

import io.mermaidast.core.render.RenderOptions;
import io.mermaidast.flowchart.analysis.GraphQueries;
import io.mermaidast.flowchart.impl.ChainSurgery;
import io.mermaidast.flowchart.parser.FlowchartParser;
import io.mermaidast.flowchart.render.FlowchartRenderer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Fluent editor over one owned {@link FlowchartAst}.
 *
 * <p>Mutating methods return {@code this}. Methods naming a node, link or subgraph that does not
 * exist do nothing. Not thread-safe.
 *
 * <pre>{@code
 * String text =
 *     Flowchart.parse("flowchart LR\n  A --> B --> C")
 *         .insertBetween("X", "A", "B")
 *         .addClass("X", "highlight")
 *         .render(RenderOptions.builder().compactLinks(true).build());
 * }</pre>
 */
public final class Flowchart {
  private final FlowchartAst ast;

  private Flowchart(FlowchartAst ast) {
    this.ast = ast;
  }

  /** An empty top-down flowchart. */
  public static Flowchart create() {
    return create(FlowchartDirection.TD);
  }

  public static Flowchart create(FlowchartDirection direction) {
    return new Flowchart(new FlowchartAst(direction));
  }

  /** Wraps {@code ast} without copying it; edits through the wrapper change it. */
  public static Flowchart from(FlowchartAst ast) {
    return new Flowchart(Objects.requireNonNull(ast, "ast must not be null"));
  }

  /**
   * Parses flowchart text.
   *
   * @throws io.mermaidast.core.api.DiagramParseException if the text is not a valid flowchart
   */
  public static Flowchart parse(String text) {
    return new Flowchart(FlowchartParser.parse(text));
  }

  public FlowchartAst toAst() {
    return ast;
  }

  public String render() {
    return FlowchartRenderer.render(ast);
  }

  /**
   * Renders the flowchart.
   *
   * @throws io.mermaidast.core.api.DiagramRenderException if a link or subgraph refers to a node
   *     that does not exist
   */
  public String render(RenderOptions options) {
    return FlowchartRenderer.render(ast, options);
  }

  /** Independent deep copy. */
  @Override
  public Flowchart clone() {
    return new Flowchart(ast.copy());
  }

  // === Accessors ===

  public FlowchartDirection direction() {
    return ast.direction();
  }

  public Flowchart setDirection(FlowchartDirection direction) {
    ast.setDirection(direction);
    return this;
  }

  public List<String> nodeIds() {
    return List.copyOf(ast.nodes().keySet());
  }

  public List<FlowchartNode> nodes() {
    return List.copyOf(ast.nodes().values());
  }

  public List<FlowchartLink> links() {
    return List.copyOf(ast.links());
  }

  public List<FlowchartSubgraph> subgraphs() {
    return Collections.unmodifiableList(ast.subgraphs());
  }

  public int nodeCount() {
    return ast.nodes().size();
  }

  public int linkCount() {
    return ast.links().size();
  }

  public boolean hasNode(String id) {
    return ast.nodes().containsKey(id);
  }

  public Optional<FlowchartNode> getNode(String id) {
    return Optional.ofNullable(ast.nodes().get(id));
  }

  public Optional<FlowchartLink> getLink(int index) {
    return inRange(index) ? Optional.of(ast.links().get(index)) : Optional.empty();
  }

  public Optional<FlowchartSubgraph> getSubgraph(String id) {
    for (FlowchartSubgraph sg : ast.subgraphs()) {
      if (sg.id().equals(id)) {
        return Optional.of(sg);
      }
    }
    return Optional.empty();
  }

  // === Nodes ===

  public Flowchart addNode(String id) {
    return addNode(id, null, NodeOptions.DEFAULT);
  }

  public Flowchart addNode(String id, String text) {
    return addNode(id, text, NodeOptions.DEFAULT);
  }

  /**
   * Adds a node, replacing any node with the same id. Classes in {@code options} replace the
   * node's classes; with none given, existing classes are kept.
   *
   * @throws IllegalArgumentException if {@code id} is not a valid node id
   */
  public Flowchart addNode(String id, String text, NodeOptions options) {
    if (!FlowchartNode.isValidId(id)) {
      throw new IllegalArgumentException("Invalid node id: '" + id + "'");
    }
    Objects.requireNonNull(options, "options must not be null");
    ast.nodes().put(id, new FlowchartNode(id, options.shape(), emptyToNull(text)));
    if (!options.classes().isEmpty()) {
      ast.classes().put(id, new ArrayList<>(options.classes()));
    }
    return this;
  }

  public Flowchart removeNode(String id) {
    return removeNode(id, false);
  }

  /**
   * Removes a node and everything attached to it.
   *
   * @param reconnect link each predecessor to each successor before removing
   */
  public Flowchart removeNode(String id, boolean reconnect) {
    ChainSurgery.removeNode(ast, id, reconnect);
    return this;
  }

  public Flowchart removeAndReconnect(String id) {
    return removeNode(id, true);
  }

  /** Sets the label; {@code null} or empty falls back to the id. */
  public Flowchart setNodeText(String id, String text) {
    FlowchartNode node = ast.nodes().get(id);
    if (node != null) {
      ast.nodes().put(id, node.withText(emptyToNull(text)));
    }
    return this;
  }

  public Flowchart setNodeShape(String id, NodeShape shape) {
    Objects.requireNonNull(shape, "shape must not be null");
    FlowchartNode node = ast.nodes().get(id);
    if (node != null) {
      ast.nodes().put(id, node.withShape(shape));
    }
    return this;
  }

  /**
   * Assigns a class; assigning the same class twice has no effect.
   *
   * @throws IllegalArgumentException if {@code className} is not a valid class name
   */
  public Flowchart addClass(String id, String className) {
    if (!FlowchartNode.isValidId(className)) {
      throw new IllegalArgumentException("Invalid class name: '" + className + "'");
    }
    List<String> classes = ast.classes().computeIfAbsent(id, k -> new ArrayList<>());
    if (!classes.contains(className)) {
      classes.add(className);
    }
    return this;
  }

  public Flowchart removeClass(String id, String className) {
    List<String> classes = ast.classes().get(id);
    if (classes != null && classes.remove(className) && classes.isEmpty()) {
      ast.classes().remove(id);
    }
    return this;
  }

  public List<String> getClasses(String id) {
    return List.copyOf(ast.classes().getOrDefault(id, List.of()));
  }

  /** Ids of the nodes matching every criterion of {@code query}, in node order. */
  public List<String> findNodes(NodeQuery query) {
    Set<String> subgraphMembers = null;
    if (query.inSubgraph() != null) {
      subgraphMembers =
          getSubgraph(query.inSubgraph()).map(sg -> Set.copyOf(sg.nodes())).orElse(Set.of());
    }
    List<String> result = new ArrayList<>();
    for (FlowchartNode node : ast.nodes().values()) {
      String id = node.id();
      if (query.className() != null
          && !ast.classes().getOrDefault(id, List.of()).contains(query.className())) {
        continue;
      }
      if (query.shape() != null && node.shape() != query.shape()) {
        continue;
      }
      if (query.textContains() != null && !node.label().contains(query.textContains())) {
        continue;
      }
      if (query.textMatches() != null && !query.textMatches().matcher(node.label()).find()) {
        continue;
      }
      if (subgraphMembers != null && !subgraphMembers.contains(id)) {
        continue;
      }
      result.add(id);
    }
    return result;
  }

  // === Links ===

  public Flowchart addLink(String source, String target) {
    return addLink(source, target, LinkOptions.DEFAULT);
  }

  /** Appends a link. Endpoints are not created; rendering requires both to exist. */
  public Flowchart addLink(String source, String target, LinkOptions options) {
    ast.links().add(options.toLink(source, target));
    return this;
  }

  public Flowchart removeLink(int index) {
    if (inRange(index)) {
      ast.links().remove(index);
    }
    return this;
  }

  public Flowchart removeLinksBetween(String source, String target) {
    ChainSurgery.removeLinksBetween(ast, source, target);
    return this;
  }

  /** Swaps source and target of the link at {@code index}. */
  public Flowchart flipLink(int index) {
    if (inRange(index)) {
      ast.links().set(index, ast.links().get(index).reversed());
    }
    return this;
  }

  public Flowchart setLinkType(int index, LinkType type) {
    if (inRange(index)) {
      ast.links().set(index, ast.links().get(index).withType(type));
    }
    return this;
  }

  public Flowchart setLinkStroke(int index, LinkStroke stroke) {
    if (inRange(index)) {
      ast.links().set(index, ast.links().get(index).withStroke(stroke));
    }
    return this;
  }

  /** Sets the link label; {@code null} removes it. */
  public Flowchart setLinkText(int index, String text) {
    if (inRange(index)) {
      ast.links().set(index, ast.links().get(index).withText(emptyToNull(text)));
    }
    return this;
  }

  public List<LinkRef> getLinksFrom(String id) {
    List<LinkRef> refs = new ArrayList<>();
    for (int i = 0; i < ast.links().size(); i++) {
      if (ast.links().get(i).source().equals(id)) {
        refs.add(new LinkRef(i, ast.links().get(i)));
      }
    }
    return refs;
  }

  public List<LinkRef> getLinksTo(String id) {
    List<LinkRef> refs = new ArrayList<>();
    for (int i = 0; i < ast.links().size(); i++) {
      if (ast.links().get(i).target().equals(id)) {
        refs.add(new LinkRef(i, ast.links().get(i)));
      }
    }
    return refs;
  }

  /** One link from each of {@code sources} to {@code target}. */
  public Flowchart addLinksFromMany(List<String> sources, String target, LinkOptions options) {
    for (String source : sources) {
      addLink(source, target, options);
    }
    return this;
  }

  /** One link from {@code source} to each of {@code targets}. */
  public Flowchart addLinksToMany(String source, List<String> targets, LinkOptions options) {
    for (String target : targets) {
      addLink(source, target, options);
    }
    return this;
  }

  // === Subgraphs ===

  public Flowchart createSubgraph(String id, List<String> nodeIds) {
    return createSubgraph(id, nodeIds, null);
  }

  /**
   * Appends a subgraph holding {@code nodeIds}, taking them out of any other subgraph.
   *
   * @throws IllegalArgumentException if {@code id} is not a valid id
   */
  public Flowchart createSubgraph(String id, List<String> nodeIds, String title) {
    if (!FlowchartNode.isValidId(id)) {
      throw new IllegalArgumentException("Invalid subgraph id: '" + id + "'");
    }
    detachFromSubgraphs(nodeIds);
    ast.subgraphs().add(new FlowchartSubgraph(id, emptyToNull(title), null, nodeIds));
    return this;
  }

  /** Removes the subgraph; its nodes stay in the diagram. */
  public Flowchart dissolveSubgraph(String id) {
    for (int i = 0; i < ast.subgraphs().size(); i++) {
      if (ast.subgraphs().get(i).id().equals(id)) {
        ast.subgraphs().remove(i);
        break;
      }
    }
    return this;
  }

  /** Moves {@code nodeIds} into subgraph {@code subgraphId}, or out of all subgraphs if absent. */
  public Flowchart moveToSubgraph(List<String> nodeIds, String subgraphId) {
    detachFromSubgraphs(nodeIds);
    getSubgraph(subgraphId).ifPresent(sg -> sg.nodes().addAll(nodeIds));
    return this;
  }

  public Flowchart extractFromSubgraph(List<String> nodeIds) {
    detachFromSubgraphs(nodeIds);
    return this;
  }

  /** Moves all members of {@code sourceId} into {@code targetId} and dissolves the source. */
  public Flowchart mergeSubgraphs(String sourceId, String targetId) {
    Optional<FlowchartSubgraph> source = getSubgraph(sourceId);
    Optional<FlowchartSubgraph> target = getSubgraph(targetId);
    if (source.isPresent() && target.isPresent() && source.get() != target.get()) {
      target.get().nodes().addAll(source.get().nodes());
      dissolveSubgraph(sourceId);
    }
    return this;
  }

  private void detachFromSubgraphs(List<String> nodeIds) {
    Set<String> ids = new HashSet<>(nodeIds);
    for (FlowchartSubgraph sg : ast.subgraphs()) {
      sg.nodes().removeIf(ids::contains);
    }
  }

  // === Chains ===

  public Flowchart insertBetween(String newId, String source, String target) {
    return insertBetween(newId, source, target, null);
  }

  /**
   * Puts a new node on the {@code source -> target} link.
   *
   * @throws IllegalArgumentException if {@code newId} is not a valid node id
   */
  public Flowchart insertBetween(String newId, String source, String target, String text) {
    if (!FlowchartNode.isValidId(newId)) {
      throw new IllegalArgumentException("Invalid node id: '" + newId + "'");
    }
    ChainSurgery.insertBetween(ast, newId, source, target, text);
    return this;
  }

  public Flowchart yankChain(List<String> nodeIds) {
    ChainSurgery.yankChain(ast, nodeIds);
    return this;
  }

  public Flowchart spliceChain(List<String> nodeIds, String source, String target) {
    return spliceChain(nodeIds, source, target, LinkOptions.DEFAULT);
  }

  public Flowchart spliceChain(
      List<String> nodeIds, String source, String target, LinkOptions options) {
    ChainSurgery.spliceChain(ast, nodeIds, source, target, options.toLink(source, target));
    return this;
  }

  public Flowchart reverseChain(List<String> nodeIds) {
    ChainSurgery.reverseChain(ast, nodeIds);
    return this;
  }

  /** Removes the chain from this flowchart and returns it as a new one. */
  public Flowchart extractChain(List<String> nodeIds) {
    return new Flowchart(ChainSurgery.extractChain(ast, nodeIds));
  }

  public Flowchart rebaseNodes(List<String> nodeIds, String newParent) {
    ChainSurgery.rebaseNodes(ast, nodeIds, newParent);
    return this;
  }

  // === Queries ===

  public List<String> getReachable(String start) {
    return GraphQueries.reachable(ast, start);
  }

  public List<String> getAncestors(String target) {
    return GraphQueries.ancestors(ast, target);
  }

  public List<String> getPath(String source, String target) {
    return GraphQueries.shortestPath(ast, source, target);
  }

  public List<String> getChain(String start, String end) {
    return GraphQueries.linearChain(ast, start, end);
  }

  private boolean inRange(int index) {
    return index >= 0 && index < ast.links().size();
  }

  private static String emptyToNull(String text) {
    return text == null || text.isEmpty() ? null : text;
  }

  @Override
  public String toString() {
    return "Flowchart{" + ast + "}";
  }
}
