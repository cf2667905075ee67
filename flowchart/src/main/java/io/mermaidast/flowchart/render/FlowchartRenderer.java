package io.mermaidast.flowchart.render;

import io.mermaidast.core.api.DiagramRenderException;
import io.mermaidast.core.doc.Doc;
import io.mermaidast.core.render.RenderOptions;
import io.mermaidast.flowchart.api.FlowchartAst;
import io.mermaidast.flowchart.api.FlowchartClassDef;
import io.mermaidast.flowchart.api.FlowchartClick;
import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.api.FlowchartLinkStyle;
import io.mermaidast.flowchart.api.FlowchartSubgraph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a {@link FlowchartAst} as flowchart source text.
 *
 * <p>Output order is: header, accessibility lines, subgraph blocks, remaining nodes and links,
 * {@code classDef}, {@code class}, {@code style}, {@code click} and {@code linkStyle} statements.
 * Each node is declared with its brackets exactly once, the first time it is printed; later
 * mentions use the bare id. Numeric {@code linkStyle} indices are renumbered to the order in which
 * links are printed. The output always parses back to an equivalent AST.
 */
public final class FlowchartRenderer {
  private static final Logger LOG = LoggerFactory.getLogger(FlowchartRenderer.class);

  private final FlowchartAst ast;
  private final RenderOptions options;
  private final Set<String> renderedNodes = new HashSet<>();
  // insertion order is print order
  private final Set<Integer> renderedLinks = new LinkedHashSet<>();
  private int chainCount;

  private FlowchartRenderer(FlowchartAst ast, RenderOptions options) {
    this.ast = Objects.requireNonNull(ast, "ast must not be null");
    this.options = Objects.requireNonNull(options, "options must not be null");
  }

  public static String render(FlowchartAst ast) {
    return render(ast, RenderOptions.DEFAULT);
  }

  /**
   * Renders {@code ast} with the given options.
   *
   * @throws DiagramRenderException if a link or subgraph refers to a node that is not in the node
   *     map
   */
  public static String render(FlowchartAst ast, RenderOptions options) {
    FlowchartRenderer renderer = new FlowchartRenderer(ast, options);
    String text = renderer.toDoc().render(options.indent());
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "Rendered flowchart: {} lines, {} chains (compact={})",
          text.split("\n", -1).length,
          renderer.chainCount,
          options.compactLinks());
    }
    return text;
  }

  /** Builds the document without printing it. */
  public static Doc toDoc(FlowchartAst ast, RenderOptions options) {
    return new FlowchartRenderer(ast, options).toDoc();
  }

  private Doc toDoc() {
    validate();
    List<Doc> body = new ArrayList<>();
    body.add(renderAccessibility());
    for (FlowchartSubgraph sg : ast.subgraphs()) {
      body.add(renderSubgraph(sg));
    }
    body.add(options.compactLinks() ? renderCompact() : renderNonCompact());
    body.add(renderClassDefs());
    body.add(renderClassAssignments());
    body.add(renderNodeStyles());
    body.add(renderClicks());
    body.add(renderLinkStyles());
    return Doc.seq(Doc.line("flowchart " + ast.direction().name()), Doc.indent(Doc.seq(body)));
  }

  private void validate() {
    Map<String, ?> nodes = ast.nodes();
    for (int i = 0; i < ast.links().size(); i++) {
      FlowchartLink link = ast.links().get(i);
      if (!nodes.containsKey(link.source()) || !nodes.containsKey(link.target())) {
        throw new DiagramRenderException(
            "Link "
                + i
                + " ("
                + link.source()
                + " -> "
                + link.target()
                + ") refers to a node that does not exist");
      }
    }
    for (FlowchartSubgraph sg : ast.subgraphs()) {
      for (String member : sg.nodes()) {
        if (!nodes.containsKey(member)) {
          throw new DiagramRenderException(
              "Subgraph '" + sg.id() + "' contains unknown node '" + member + "'");
        }
      }
    }
  }

  private Doc renderAccessibility() {
    List<Doc> lines = new ArrayList<>();
    if (ast.title() != null && !ast.title().isBlank()) {
      // accTitle is a single-line statement
      lines.add(Doc.line("accTitle: " + String.join(" ", nonBlankLines(ast.title()))));
    }
    String descr = ast.accDescription();
    if (descr != null && !descr.isBlank()) {
      List<String> descrLines = nonBlankLines(descr);
      if (descrLines.size() > 1) {
        lines.add(Doc.block("accDescr {", Doc.lines(descrLines), "}"));
      } else {
        lines.add(Doc.line("accDescr: " + descrLines.get(0)));
      }
    }
    return Doc.seq(lines);
  }

  private static List<String> nonBlankLines(String text) {
    List<String> out = new ArrayList<>();
    for (String l : text.split("\\R")) {
      if (!l.isBlank()) {
        out.add(l.trim());
      }
    }
    return out;
  }

  private Doc renderSubgraph(FlowchartSubgraph sg) {
    String title = sg.displayTitle();
    String header =
        title.equals(sg.id())
            ? "subgraph " + sg.id()
            : "subgraph " + sg.id() + "[" + Labels.quoteIfNeeded(title) + "]";

    List<String> members = new ArrayList<>(sg.nodes());
    if (options.sortNodes()) {
      members.sort(null);
    }
    List<Doc> content = new ArrayList<>();
    if (sg.direction() != null) {
      content.add(Doc.line("direction " + sg.direction().name()));
    }
    for (String id : members) {
      if (!renderedNodes.contains(id)) {
        content.add(Doc.line(declare(id)));
      }
    }
    for (int i = 0; i < ast.links().size(); i++) {
      FlowchartLink link = ast.links().get(i);
      if (!renderedLinks.contains(i) && sg.contains(link.source()) && sg.contains(link.target())) {
        content.add(Doc.line(linkLine(link)));
        renderedLinks.add(i);
      }
    }
    return Doc.block(header, Doc.seq(content), "end");
  }

  private Doc renderNonCompact() {
    Map<String, List<Integer>> linksBySource = new LinkedHashMap<>();
    for (int i = 0; i < ast.links().size(); i++) {
      if (!renderedLinks.contains(i)) {
        String source = ast.links().get(i).source();
        linksBySource.computeIfAbsent(source, k -> new ArrayList<>()).add(i);
      }
    }
    List<Doc> content = new ArrayList<>();
    for (String id : nodeOrder()) {
      if (renderedNodes.contains(id)) {
        continue;
      }
      List<Integer> outgoing = linksBySource.getOrDefault(id, List.of());
      if (outgoing.isEmpty()) {
        content.add(Doc.line(declare(id)));
        continue;
      }
      for (int index : outgoing) {
        FlowchartLink link = ast.links().get(index);
        content.add(Doc.line(linkLine(link)));
        renderedLinks.add(index);
      }
    }
    content.add(renderRemainingLinks());
    return Doc.seq(content);
  }

  private Doc renderCompact() {
    List<ChainCompactor.Chain> chains = ChainCompactor.buildChains(ast.links(), renderedLinks);
    chainCount = chains.size();
    List<Doc> content = new ArrayList<>();
    for (ChainCompactor.Chain chain : chains) {
      StringBuilder sb = new StringBuilder(ref(chain.nodeIds().get(0)));
      for (int i = 0; i < chain.linkIndices().size(); i++) {
        FlowchartLink link = ast.links().get(chain.linkIndices().get(i));
        sb.append(' ').append(LinkSyntax.render(link)).append(' ');
        sb.append(ref(chain.nodeIds().get(i + 1)));
      }
      content.add(Doc.line(sb.toString()));
      renderedLinks.addAll(chain.linkIndices());
    }
    for (String id : nodeOrder()) {
      if (!renderedNodes.contains(id)) {
        content.add(Doc.line(declare(id)));
      }
    }
    content.add(renderRemainingLinks());
    return Doc.seq(content);
  }

  private Doc renderRemainingLinks() {
    List<Doc> content = new ArrayList<>();
    for (int i = 0; i < ast.links().size(); i++) {
      if (renderedLinks.add(i)) {
        content.add(Doc.line(linkLine(ast.links().get(i))));
      }
    }
    return Doc.seq(content);
  }

  private String linkLine(FlowchartLink link) {
    String source = ref(link.source());
    return source + " " + LinkSyntax.render(link) + " " + ref(link.target());
  }

  private List<String> nodeOrder() {
    List<String> ids = new ArrayList<>(ast.nodes().keySet());
    if (options.sortNodes()) {
      ids.sort(null);
    }
    return ids;
  }

  /** Full declaration the first time a node is printed, bare id afterwards. */
  private String ref(String id) {
    return renderedNodes.contains(id) ? id : declare(id);
  }

  private String declare(String id) {
    renderedNodes.add(id);
    StringBuilder sb = new StringBuilder(id).append(ShapeSyntax.render(ast.nodes().get(id)));
    if (options.inlineClasses()) {
      List<String> classes = ast.classes().get(id);
      if (classes != null && !classes.isEmpty()) {
        sb.append(":::").append(String.join(",", classes));
      }
    }
    return sb.toString();
  }

  private Doc renderClassDefs() {
    List<Doc> lines = new ArrayList<>();
    for (FlowchartClassDef def : ast.classDefs().values()) {
      String styles = formatStyles(def.styles());
      lines.add(Doc.line("classDef " + def.name() + (styles.isEmpty() ? "" : " " + styles)));
    }
    return Doc.seq(lines);
  }

  /** One statement per node, so each node's class order survives a re-parse. */
  private Doc renderClassAssignments() {
    List<Doc> lines = new ArrayList<>();
    ast.classes()
        .forEach(
            (id, classes) -> {
              // inline suffixes only exist on declared nodes
              if (classes.isEmpty() || options.inlineClasses() && ast.nodes().containsKey(id)) {
                return;
              }
              lines.add(Doc.line("class " + id + " " + String.join(",", classes)));
            });
    return Doc.seq(lines);
  }

  private Doc renderNodeStyles() {
    List<Doc> lines = new ArrayList<>();
    ast.nodeStyles()
        .forEach(
            (id, styles) -> {
              if (!styles.isEmpty()) {
                lines.add(Doc.line("style " + id + " " + formatStyles(styles)));
              }
            });
    return Doc.seq(lines);
  }

  private Doc renderClicks() {
    List<Doc> lines = new ArrayList<>();
    for (FlowchartClick click : ast.clicks()) {
      StringBuilder sb = new StringBuilder("click ").append(click.nodeId());
      if (click.isHref()) {
        sb.append(" href ").append(Labels.quote(click.href()));
      } else if (click.callbackArgs() != null) {
        sb.append(" call ").append(click.callback());
        sb.append('(').append(click.callbackArgs()).append(')');
      } else {
        sb.append(' ').append(click.callback());
      }
      if (click.tooltip() != null) {
        sb.append(' ').append(Labels.quote(click.tooltip()));
      }
      if (click.isHref() && click.target() != null) {
        sb.append(' ').append(click.target());
      }
      lines.add(Doc.line(sb.toString()));
    }
    return Doc.seq(lines);
  }

  private Doc renderLinkStyles() {
    Map<Integer, Integer> printedPosition = new HashMap<>();
    for (int index : renderedLinks) {
      printedPosition.put(index, printedPosition.size());
    }
    List<Doc> lines = new ArrayList<>();
    for (FlowchartLinkStyle ls : ast.linkStyles()) {
      StringBuilder sb = new StringBuilder("linkStyle ");
      if (ls.isDefault()) {
        sb.append("default");
      } else {
        // indices past the last link stay as written
        sb.append(printedPosition.getOrDefault(ls.index(), ls.index()));
      }
      if (ls.interpolate() != null) {
        sb.append(" interpolate ").append(ls.interpolate());
      }
      String styles = formatStyles(ls.styles());
      if (!styles.isEmpty()) {
        sb.append(' ').append(styles);
      }
      lines.add(Doc.line(sb.toString()));
    }
    return Doc.seq(lines);
  }

  static String formatStyles(Map<String, String> styles) {
    List<String> parts = new ArrayList<>(styles.size());
    styles.forEach((k, v) -> parts.add(v.isEmpty() ? k : k + ":" + v));
    return String.join(",", parts);
  }
}
