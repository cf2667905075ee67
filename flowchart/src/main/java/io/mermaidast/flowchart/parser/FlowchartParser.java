package io.mermaidast.flowchart.parser;

import io.mermaidast.core.api.DiagramParseException;
import io.mermaidast.flowchart.api.FlowchartAst;
import io.mermaidast.flowchart.api.FlowchartClassDef;
import io.mermaidast.flowchart.api.FlowchartClick;
import io.mermaidast.flowchart.api.FlowchartDirection;
import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.api.FlowchartLinkStyle;
import io.mermaidast.flowchart.api.FlowchartNode;
import io.mermaidast.flowchart.api.FlowchartSubgraph;
import io.mermaidast.flowchart.api.LinkStroke;
import io.mermaidast.flowchart.api.LinkType;
import io.mermaidast.flowchart.api.NodeShape;
import io.mermaidast.flowchart.render.ShapeSyntax;
import io.mermaidast.flowchart.render.ShapeSyntax.Brackets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for flowchart source text.
 *
 * <p>Grammar (simplified):
 *
 * <pre>
 * diagram    := frontmatter? header (sep statement)*
 * header     := ('flowchart' | 'graph') direction?
 * statement  := subgraph | 'end' | direction | classDef | class | style | click | linkStyle
 *             | accTitle | accDescr | vertices
 * vertices   := group (link group)*
 * group      := node ('&amp;' node)*
 * node       := id shape? (':::' classes)*
 * link       := ('o' | 'x')? body head? ('|' text '|')?
 * sep        := newline | ';'
 * </pre>
 *
 * <p>Nested subgraphs are flattened: a node belongs to the innermost open subgraph that mentions
 * it first, and subgraphs are listed in the order they are closed.
 */
public final class FlowchartParser {
  private static final Logger LOG = LoggerFactory.getLogger(FlowchartParser.class);

  private record LinkSpec(LinkType type, LinkStroke stroke, int length, String text) {
    LinkSpec withText(String text) {
      return new LinkSpec(type, stroke, length, text);
    }
  }

  private final String input;
  private int pos;

  private final FlowchartAst ast = new FlowchartAst(FlowchartDirection.TB);
  private final Deque<FlowchartSubgraph> openSubgraphs = new ArrayDeque<>();
  private final Deque<Integer> openSubgraphPositions = new ArrayDeque<>();
  private final Map<String, FlowchartSubgraph> owners = new HashMap<>();
  private int subgraphCounter;

  private FlowchartParser(String input) {
    this.input = input.replace("\r\n", "\n").replace('\r', '\n');
    this.pos = 0;
  }

  /**
   * Parses flowchart source text.
   *
   * @param text the diagram source
   * @return the parsed AST
   * @throws DiagramParseException if the text is not a valid flowchart
   */
  public static FlowchartAst parse(String text) {
    if (text == null || text.isBlank()) {
      throw new DiagramParseException("Empty flowchart");
    }
    FlowchartAst ast = new FlowchartParser(text).parseDiagram();
    LOG.debug(
        "Parsed flowchart: {} nodes, {} links, {} subgraphs",
        ast.nodes().size(),
        ast.links().size(),
        ast.subgraphs().size());
    return ast;
  }

  private FlowchartAst parseDiagram() {
    skipSeparators();
    if (lookahead("---")) {
      parseFrontMatter();
      skipSeparators();
    }
    parseHeader();
    while (true) {
      skipSeparators();
      if (isAtEnd()) {
        break;
      }
      parseStatement();
      endStatement();
    }
    if (!openSubgraphs.isEmpty()) {
      throw error(
          "Unterminated subgraph '" + openSubgraphs.peek().id() + "'",
          openSubgraphPositions.peek());
    }
    return ast;
  }

  // === Header ===

  private void parseFrontMatter() {
    int start = pos;
    skipToEndOfLine();
    while (!isAtEnd()) {
      advance(); // newline
      String line = readLine().trim();
      if (line.equals("---")) {
        return;
      }
      if (line.startsWith("title:")) {
        ast.setTitle(unquoteYaml(line.substring("title:".length()).trim()));
      }
    }
    throw error("Unterminated front matter", start);
  }

  private void parseHeader() {
    int start = pos;
    if (!(matchWord("flowchart-elk") || matchWord("flowchart") || matchWord("graph"))) {
      throw error("Expected 'flowchart' or 'graph' header", start);
    }
    skipInlineWs();
    if (!atStatementEnd()) {
      int dirPos = pos;
      String token = readWord();
      FlowchartDirection direction = FlowchartDirection.fromToken(token);
      if (direction == null) {
        throw error("Unknown direction '" + token + "'", dirPos);
      }
      ast.setDirection(direction);
    }
    endStatement();
  }

  // === Statements ===

  private void parseStatement() {
    int start = pos;
    if (matchStatementKeyword("subgraph")) {
      parseSubgraphHeader(start);
    } else if (matchEndKeyword()) {
      closeSubgraph(start);
    } else if (matchDirectionStatement()) {
      // handled
    } else if (matchStatementKeyword("classDef")) {
      parseClassDef();
    } else if (matchStatementKeyword("class")) {
      parseClassStatement();
    } else if (matchStatementKeyword("style")) {
      parseStyle();
    } else if (matchStatementKeyword("click")) {
      parseClick();
    } else if (matchStatementKeyword("linkStyle")) {
      parseLinkStyle();
    } else if (matchAccKeyword("accTitle")) {
      ast.setTitle(readLine().trim());
    } else if (matchAccKeyword("accDescr")) {
      parseAccDescr(start);
    } else {
      parseVertexStatement();
    }
  }

  private void parseSubgraphHeader(int start) {
    String id;
    String title = null;
    if (peek() == '"') {
      title = parseQuotedString();
      id = "subGraph" + subgraphCounter;
    } else {
      int idPos = pos;
      id = parseNodeId();
      skipInlineWs();
      if (peek() == '[') {
        advance();
        title = parseBracketTitle(idPos);
      } else if (!atStatementEnd()) {
        readToStatementEnd();
        title = input.substring(idPos, pos).trim();
        id = "subGraph" + subgraphCounter;
      }
    }
    subgraphCounter++;
    if (title != null && (title.isEmpty() || title.equals(id))) {
      title = null;
    }
    openSubgraphs.push(new FlowchartSubgraph(id, title, null, List.of()));
    openSubgraphPositions.push(start);
  }

  private String parseBracketTitle(int start) {
    if (peek() == '"') {
      String title = parseQuotedString();
      expect(']');
      return title;
    }
    int textStart = pos;
    while (!isAtEnd() && peek() != ']' && peek() != '\n') {
      pos++;
    }
    if (peek() != ']') {
      throw error("Unterminated subgraph title", start);
    }
    String title = input.substring(textStart, pos).trim();
    advance();
    return title;
  }

  private void closeSubgraph(int start) {
    if (openSubgraphs.isEmpty()) {
      throw error("Unexpected 'end' without an open subgraph", start);
    }
    openSubgraphPositions.pop();
    ast.subgraphs().add(openSubgraphs.pop());
  }

  private boolean matchDirectionStatement() {
    int save = pos;
    if (!matchWord("direction")) {
      return false;
    }
    skipInlineWs();
    FlowchartDirection direction = FlowchartDirection.fromToken(readWord());
    skipInlineWs();
    if (direction == null || !atStatementEnd()) {
      pos = save;
      return false;
    }
    if (openSubgraphs.isEmpty()) {
      ast.setDirection(direction);
    } else {
      openSubgraphs.peek().setDirection(direction);
    }
    return true;
  }

  private void parseClassDef() {
    List<String> names = parseNameList();
    skipInlineWs();
    Map<String, String> styles = parseStyles();
    for (String name : names) {
      ast.classDefs().put(name, new FlowchartClassDef(name, styles));
    }
  }

  private void parseClassStatement() {
    List<String> ids = new ArrayList<>();
    ids.add(parseNodeId());
    while (matchInline(',')) {
      skipInlineWs();
      ids.add(parseNodeId());
    }
    skipInlineWs();
    List<String> classNames = parseNameList();
    for (String id : ids) {
      for (String cls : classNames) {
        addClass(id, cls);
      }
    }
  }

  private void parseStyle() {
    String id = parseNodeId();
    skipInlineWs();
    ast.nodeStyles().computeIfAbsent(id, k -> new LinkedHashMap<>()).putAll(parseStyles());
  }

  private void parseClick() {
    int start = pos;
    String id = parseNodeId();
    skipInlineWs();
    String href = null;
    String callback = null;
    String args = null;
    if (matchWord("href")) {
      skipInlineWs();
      if (peek() != '"') {
        throw error("Expected quoted URL after 'href'", pos);
      }
      href = parseQuotedString();
    } else if (peek() == '"') {
      href = parseQuotedString();
    } else if (matchWord("call")) {
      skipInlineWs();
      callback = parseCallbackName();
      args = "";
      if (peek() == '(') {
        advance();
        int argsStart = pos;
        while (!isAtEnd() && peek() != ')' && peek() != '\n') {
          pos++;
        }
        if (peek() != ')') {
          throw error("Unterminated callback arguments", argsStart);
        }
        args = input.substring(argsStart, pos).trim();
        advance();
      }
    } else {
      callback = parseCallbackName();
    }
    if (callback != null && callback.isEmpty()) {
      throw error("Expected URL or callback in click statement", start);
    }
    skipInlineWs();
    String tooltip = peek() == '"' ? parseQuotedString() : null;
    skipInlineWs();
    String target = null;
    if (href != null && !atStatementEnd()) {
      target = readWord();
    }
    FlowchartClick click;
    try {
      click = new FlowchartClick(id, href, callback, args, target, tooltip);
    } catch (IllegalArgumentException e) {
      throw error(e.getMessage(), start);
    }
    ast.clicks().removeIf(c -> c.nodeId().equals(id));
    ast.clicks().add(click);
  }

  private void parseLinkStyle() {
    List<Integer> indices = new ArrayList<>();
    do {
      skipInlineWs();
      if (matchWord("default")) {
        indices.add(FlowchartLinkStyle.DEFAULT_INDEX);
      } else {
        indices.add(parseLinkIndex());
      }
    } while (matchInline(','));
    skipInlineWs();
    String interpolate = null;
    if (matchWord("interpolate")) {
      skipInlineWs();
      int curvePos = pos;
      interpolate = readWord();
      if (interpolate.isEmpty()) {
        throw error("Expected curve name after 'interpolate'", curvePos);
      }
      skipInlineWs();
    }
    Map<String, String> styles = parseStyles();
    for (int index : indices) {
      ast.linkStyles().add(new FlowchartLinkStyle(index, styles, interpolate));
    }
  }

  private int parseLinkIndex() {
    int start = pos;
    while (!isAtEnd() && Character.isDigit(peek())) {
      pos++;
    }
    if (pos == start) {
      throw error("Expected link index or 'default'", start);
    }
    try {
      return Integer.parseInt(input.substring(start, pos));
    } catch (NumberFormatException e) {
      throw error("Link index out of range", start);
    }
  }

  private void parseAccDescr(int start) {
    if (peek() == ':') {
      advance();
      ast.setAccDescription(readLine().trim());
      return;
    }
    advance(); // '{'
    int close = input.indexOf('}', pos);
    if (close < 0) {
      throw error("Unterminated accDescr block", start);
    }
    List<String> lines = new ArrayList<>();
    for (String line : input.substring(pos, close).split("\n")) {
      if (!line.isBlank()) {
        lines.add(line.trim());
      }
    }
    ast.setAccDescription(String.join("\n", lines));
    pos = close + 1;
  }

  // === Vertices and links ===

  private void parseVertexStatement() {
    List<String> left = parseNodeGroup();
    while (true) {
      skipInlineWs();
      if (!isLinkStartAt(pos)) {
        break;
      }
      LinkSpec link = parseLink();
      skipInlineWs();
      List<String> right = parseNodeGroup();
      for (String source : left) {
        for (String target : right) {
          ast.links()
              .add(
                  new FlowchartLink(
                      source, target, link.type(), link.stroke(), link.length(), link.text()));
        }
      }
      left = right;
    }
  }

  private List<String> parseNodeGroup() {
    List<String> ids = new ArrayList<>();
    ids.add(parseNode());
    while (true) {
      int save = pos;
      skipInlineWs();
      if (peek() != '&') {
        pos = save;
        return ids;
      }
      advance();
      skipInlineWs();
      ids.add(parseNode());
    }
  }

  private String parseNode() {
    String id = parseNodeId();
    NodeShape shape = null;
    String text = null;
    Brackets opener = findOpener();
    if (opener != null) {
      int start = pos;
      pos += opener.open().length();
      String label;
      Brackets chosen;
      if (peek() == '"') {
        label = parseQuotedString();
        chosen = matchCloser(opener.open(), pos);
        if (chosen == null) {
          throw error("Expected closing bracket after quoted label", pos);
        }
      } else {
        int scan = pos;
        chosen = null;
        while (scan < input.length() && input.charAt(scan) != '\n') {
          chosen = matchCloser(opener.open(), scan);
          if (chosen != null) {
            break;
          }
          scan++;
        }
        if (chosen == null) {
          throw error("Unterminated node label", start);
        }
        label = input.substring(pos, scan).replace("\\\"", "\"").trim();
        pos = scan;
      }
      pos += chosen.close().length();
      shape = chosen.shape();
      text = label.isEmpty() ? null : label;
    }

    FlowchartNode existing = ast.nodes().get(id);
    if (existing == null) {
      ast.nodes().put(id, new FlowchartNode(id, shape != null ? shape : NodeShape.SQUARE, text));
    } else if (shape != null) {
      ast.nodes().put(id, new FlowchartNode(id, shape, text));
    }

    while (lookahead(":::")) {
      pos += 3;
      addClass(id, parseClassName());
      while (peek() == ',') {
        advance();
        addClass(id, parseClassName());
      }
    }
    claim(id);
    return id;
  }

  private Brackets findOpener() {
    for (Brackets b : ShapeSyntax.longestOpenFirst()) {
      if (input.startsWith(b.open(), pos)) {
        return b;
      }
    }
    return null;
  }

  private Brackets matchCloser(String open, int at) {
    for (Brackets b : ShapeSyntax.longestOpenFirst()) {
      if (b.open().equals(open) && input.startsWith(b.close(), at)) {
        return b;
      }
    }
    return null;
  }

  private void claim(String id) {
    FlowchartSubgraph current = openSubgraphs.peek();
    if (current == null) {
      return;
    }
    FlowchartSubgraph owner = owners.get(id);
    if (owner == null) {
      owners.put(id, current);
      current.nodes().add(id);
    } else if (owner != current) {
      LOG.warn(
          "Node '{}' already belongs to subgraph '{}'; ignoring claim by '{}'",
          id,
          owner.id(),
          current.id());
    }
  }

  private void addClass(String id, String cls) {
    List<String> classes = ast.classes().computeIfAbsent(id, k -> new ArrayList<>());
    if (!classes.contains(cls)) {
      classes.add(cls);
    }
  }

  private LinkSpec parseLink() {
    int start = pos;
    char c = peek();
    if (c == '<') {
      throw error("Bidirectional links are not supported", start);
    }
    if (c == 'o' || c == 'x') {
      advance(); // lead-in; the head decides the type
    }
    LinkSpec link;
    if (peek() == '-' && peekAt(1) == '.') {
      link = parseDottedLink(start);
    } else if (peek() == '-' || peek() == '=') {
      link = parseSolidLink(start);
    } else {
      throw error("Malformed link", start);
    }
    int save = pos;
    skipInlineWs();
    if (peek() == '|') {
      advance();
      link = link.withText(parsePipeText());
    } else {
      pos = save;
    }
    return link;
  }

  private LinkSpec parseSolidLink(int start) {
    char strokeChar = peek();
    LinkStroke stroke = strokeChar == '=' ? LinkStroke.THICK : LinkStroke.NORMAL;
    int n = countRun(strokeChar);
    if (n < 2) {
      throw error("Malformed link", start);
    }
    LinkSpec link = finishSolid(stroke, n, null);
    if (link != null) {
      return link;
    }
    // "-- text -->" / "== text ==>"
    String closer = String.valueOf(strokeChar).repeat(2);
    int end = indexOfOnLine(closer, pos);
    if (end < 0) {
      throw error("Unterminated link text", start);
    }
    String text = unquoteIfQuoted(input.substring(pos, end).trim());
    pos = end;
    link = finishSolid(stroke, countRun(strokeChar), text);
    if (link == null) {
      throw error("Malformed link", end);
    }
    return link;
  }

  /** Head of a normal or thick link after {@code n} body characters, or null if incomplete. */
  private LinkSpec finishSolid(LinkStroke stroke, int n, String text) {
    LinkType head = parseHead(n < 3);
    if (head != null) {
      return new LinkSpec(head, stroke, Math.max(1, n - 1), emptyToNull(text));
    }
    if (n >= 3) {
      return new LinkSpec(LinkType.ARROW_OPEN, stroke, Math.max(1, n - 2), emptyToNull(text));
    }
    return null;
  }

  private LinkSpec parseDottedLink(int start) {
    advance(); // '-'
    int dots = countRun('.');
    if (peek() == '-') {
      advance();
      LinkType head = parseHead(false);
      return new LinkSpec(head != null ? head : LinkType.ARROW_OPEN, LinkStroke.DOTTED, dots, null);
    }
    // "-. text .->"
    int end = indexOfOnLine(".-", pos);
    if (end < 0) {
      throw error("Unterminated link text", start);
    }
    String text = unquoteIfQuoted(input.substring(pos, end).trim());
    pos = end;
    int closingDots = countRun('.');
    advance(); // '-'
    LinkType head = parseHead(false);
    return new LinkSpec(
        head != null ? head : LinkType.ARROW_OPEN,
        LinkStroke.DOTTED,
        Math.max(dots, closingDots),
        emptyToNull(text));
  }

  /**
   * Consumes an arrow head. {@code o} and {@code x} count as a head only when no id character
   * follows them, unless {@code force} is set because the body is too short to be an open link.
   */
  private LinkType parseHead(boolean force) {
    char c = peek();
    if (c == '>') {
      advance();
      return LinkType.ARROW_POINT;
    }
    if ((c == 'o' || c == 'x') && (force || !FlowchartNode.isIdChar(peekAt(1)))) {
      advance();
      return c == 'o' ? LinkType.ARROW_CIRCLE : LinkType.ARROW_CROSS;
    }
    return null;
  }

  private String parsePipeText() {
    int start = pos;
    skipInlineWs();
    if (peek() == '"') {
      String text = parseQuotedString();
      skipInlineWs();
      expect('|');
      return emptyToNull(text);
    }
    pos = start;
    while (!isAtEnd() && peek() != '|' && peek() != '\n') {
      pos++;
    }
    if (peek() != '|') {
      throw error("Unterminated link text", start);
    }
    String text = input.substring(start, pos).trim();
    advance();
    return emptyToNull(text);
  }

  private boolean isLinkStartAt(int at) {
    char c = charAt(at);
    if (c == '-' || c == '=') {
      return true;
    }
    if (c == '<') {
      return charAt(at + 1) == '-' || charAt(at + 1) == '=';
    }
    if (c == 'o' || c == 'x') {
      char next = charAt(at + 1);
      char after = charAt(at + 2);
      return (next == '-' || next == '=') && (after == '-' || after == '=' || after == '.');
    }
    return false;
  }

  // === Tokens ===

  private String parseNodeId() {
    int start = pos;
    while (!isAtEnd()) {
      char c = peek();
      if (FlowchartNode.isIdChar(c)) {
        pos++;
      } else if (c == '-' && pos > start && FlowchartNode.isIdChar(peekAt(1))) {
        pos++;
      } else {
        break;
      }
    }
    if (pos == start) {
      throw error("Expected node id", start);
    }
    return input.substring(start, pos);
  }

  private String parseClassName() {
    int start = pos;
    while (!isAtEnd()
        && (FlowchartNode.isIdChar(peek())
            || peek() == '-' && pos > start && FlowchartNode.isIdChar(peekAt(1)))) {
      pos++;
    }
    if (pos == start) {
      throw error("Expected class name", start);
    }
    return input.substring(start, pos);
  }

  private List<String> parseNameList() {
    List<String> names = new ArrayList<>();
    names.add(parseClassName());
    while (matchInline(',')) {
      skipInlineWs();
      names.add(parseClassName());
    }
    return names;
  }

  private String parseCallbackName() {
    int start = pos;
    while (!isAtEnd()
        && (FlowchartNode.isIdChar(peek()) || peek() == '.' || peek() == '$')) {
      pos++;
    }
    return input.substring(start, pos);
  }

  /** {@code k:v,k:v} up to the end of the statement. Commas inside parentheses do not split. */
  private Map<String, String> parseStyles() {
    String raw = readToStatementEnd().trim();
    Map<String, String> styles = new LinkedHashMap<>();
    int depth = 0;
    int partStart = 0;
    for (int i = 0; i <= raw.length(); i++) {
      char c = i < raw.length() ? raw.charAt(i) : ',';
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth = Math.max(0, depth - 1);
      } else if (c == ',' && depth == 0) {
        String part = raw.substring(partStart, i).trim();
        partStart = i + 1;
        if (part.isEmpty()) {
          continue;
        }
        int colon = part.indexOf(':');
        if (colon < 0) {
          styles.put(part, "");
        } else {
          styles.put(part.substring(0, colon).trim(), part.substring(colon + 1).trim());
        }
      }
    }
    return styles;
  }

  private String parseQuotedString() {
    int start = pos;
    advance(); // opening quote
    StringBuilder sb = new StringBuilder();
    while (!isAtEnd() && peek() != '"') {
      char c = advance();
      if (c == '\\' && !isAtEnd()) {
        char escaped = advance();
        switch (escaped) {
          case '"' -> sb.append('"');
          case '\\' -> sb.append('\\');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          default -> sb.append('\\').append(escaped);
        }
      } else {
        sb.append(c);
      }
    }
    if (isAtEnd()) {
      throw error("Unterminated quoted string", start);
    }
    advance(); // closing quote
    return sb.toString();
  }

  private String unquoteIfQuoted(String text) {
    if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
      return new FlowchartParser(text).parseQuotedString();
    }
    return text;
  }

  private static String unquoteYaml(String value) {
    if (value.length() >= 2
        && (value.startsWith("\"") && value.endsWith("\"")
            || value.startsWith("'") && value.endsWith("'"))) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  private static String emptyToNull(String text) {
    return text == null || text.isEmpty() ? null : text;
  }

  // === Lexer utilities ===

  private char peek() {
    return charAt(pos);
  }

  private char peekAt(int offset) {
    return charAt(pos + offset);
  }

  private char charAt(int at) {
    return at < input.length() ? input.charAt(at) : '\0';
  }

  private char advance() {
    return input.charAt(pos++);
  }

  private boolean isAtEnd() {
    return pos >= input.length();
  }

  private void skipInlineWs() {
    while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
      pos++;
    }
  }

  /** Skips whitespace, newlines, semicolons, {@code %%} comments and directives. */
  private void skipSeparators() {
    while (!isAtEnd()) {
      char c = peek();
      if (c == ' ' || c == '\t' || c == '\n' || c == ';') {
        pos++;
      } else if (lookahead("%%{")) {
        int end = input.indexOf("}%%", pos);
        LOG.warn("Skipping directive at line {}", lineOf(pos));
        if (end < 0) {
          skipToEndOfLine();
        } else {
          pos = end + 3;
        }
      } else if (lookahead("%%")) {
        skipToEndOfLine();
      } else {
        break;
      }
    }
  }

  private void skipToEndOfLine() {
    while (!isAtEnd() && peek() != '\n') {
      pos++;
    }
  }

  private String readLine() {
    int start = pos;
    skipToEndOfLine();
    return input.substring(start, pos);
  }

  private String readToStatementEnd() {
    int start = pos;
    while (!atStatementEnd()) {
      pos++;
    }
    return input.substring(start, pos);
  }

  private String readWord() {
    int start = pos;
    while (!atStatementEnd() && peek() != ' ' && peek() != '\t') {
      pos++;
    }
    return input.substring(start, pos);
  }

  private boolean atStatementEnd() {
    return isAtEnd() || peek() == '\n' || peek() == ';';
  }

  private void endStatement() {
    skipInlineWs();
    if (!atStatementEnd()) {
      throw error("Unexpected input", pos);
    }
  }

  private boolean lookahead(String expected) {
    return input.startsWith(expected, pos);
  }

  private boolean matchInline(char c) {
    int save = pos;
    skipInlineWs();
    if (peek() == c) {
      advance();
      return true;
    }
    pos = save;
    return false;
  }

  private void expect(char c) {
    if (peek() != c) {
      throw error("Expected '" + c + "'", pos);
    }
    advance();
  }

  /** Matches {@code word} when it is not immediately followed by an id character or dash. */
  private boolean matchWord(String word) {
    if (!input.startsWith(word, pos)) {
      return false;
    }
    char next = charAt(pos + word.length());
    if (FlowchartNode.isIdChar(next) || next == '-') {
      return false;
    }
    pos += word.length();
    return true;
  }

  /**
   * Matches a statement keyword followed by whitespace and an argument. A keyword followed by a
   * link or {@code &} is a node id instead.
   */
  private boolean matchStatementKeyword(String keyword) {
    if (!input.startsWith(keyword, pos)) {
      return false;
    }
    int at = pos + keyword.length();
    if (charAt(at) != ' ' && charAt(at) != '\t') {
      return false;
    }
    while (charAt(at) == ' ' || charAt(at) == '\t') {
      at++;
    }
    char c = charAt(at);
    if (c == '\0' || c == '\n' || c == ';' || c == '&' || isLinkStartAt(at)) {
      return false;
    }
    pos = at;
    return true;
  }

  private boolean matchEndKeyword() {
    if (!input.startsWith("end", pos)) {
      return false;
    }
    int at = pos + 3;
    while (charAt(at) == ' ' || charAt(at) == '\t') {
      at++;
    }
    char c = charAt(at);
    if (c != '\0' && c != '\n' && c != ';') {
      return false;
    }
    pos += 3;
    return true;
  }

  /**
   * Matches {@code accTitle:} (consuming the colon) or {@code accDescr} followed by a colon or an
   * opening brace (stopping on it). A colon that starts {@code :::} is a class suffix, and a brace
   * directly after the keyword with text behind it on the same line is a hexagon or diamond
   * node, so both leave the keyword to be read as a node id.
   */
  private boolean matchAccKeyword(String keyword) {
    if (!input.startsWith(keyword, pos)) {
      return false;
    }
    int at = pos + keyword.length();
    while (charAt(at) == ' ' || charAt(at) == '\t') {
      at++;
    }
    char c = charAt(at);
    if (c == ':') {
      if (input.startsWith(":::", at)) {
        return false;
      }
      pos = keyword.equals("accTitle") ? at + 1 : at;
      return true;
    }
    if (c == '{' && keyword.equals("accDescr")) {
      boolean spaced = at > pos + keyword.length();
      if (!spaced && !restOfLineIsBlank(at + 1)) {
        return false;
      }
      pos = at;
      return true;
    }
    return false;
  }

  private boolean restOfLineIsBlank(int from) {
    int at = from;
    while (charAt(at) == ' ' || charAt(at) == '\t' || charAt(at) == '\r') {
      at++;
    }
    return charAt(at) == '\0' || charAt(at) == '\n';
  }

  private int countRun(char c) {
    int start = pos;
    while (peek() == c) {
      pos++;
    }
    return pos - start;
  }

  private int indexOfOnLine(String needle, int from) {
    int lineEnd = input.indexOf('\n', from);
    int found = input.indexOf(needle, from);
    if (found < 0 || (lineEnd >= 0 && found > lineEnd)) {
      return -1;
    }
    return found;
  }

  private int lineOf(int at) {
    int line = 1;
    for (int i = 0; i < at && i < input.length(); i++) {
      if (input.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  private DiagramParseException error(String reason, int at) {
    int line = lineOf(at);
    int lineStart = at == 0 ? 0 : input.lastIndexOf('\n', at - 1) + 1;
    int column = at - lineStart + 1;
    String fragment;
    if (at >= input.length()) {
      fragment = "<end of input>";
    } else {
      int lineEnd = input.indexOf('\n', at);
      int end = Math.min(lineEnd < 0 ? input.length() : lineEnd, at + 24);
      fragment = input.substring(at, end);
    }
    return new DiagramParseException(reason, line, column, fragment);
  }
}
