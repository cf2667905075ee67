package io.mermaidast.flowchart.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.mermaidast.core.api.DiagramParseException;
import io.mermaidast.flowchart.api.FlowchartAst;
import io.mermaidast.flowchart.api.FlowchartClick;
import io.mermaidast.flowchart.api.FlowchartDirection;
import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.api.FlowchartLinkStyle;
import io.mermaidast.flowchart.api.FlowchartNode;
import io.mermaidast.flowchart.api.FlowchartSubgraph;
import io.mermaidast.flowchart.api.LinkStroke;
import io.mermaidast.flowchart.api.LinkType;
import io.mermaidast.flowchart.api.NodeShape;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FlowchartParserTest {

  private static FlowchartAst parse(String... lines) {
    return FlowchartParser.parse(String.join("\n", lines));
  }

  @Nested
  class Header {
    @Test
    void defaultsToTopToBottom() {
      assertEquals(FlowchartDirection.TB, parse("flowchart").direction());
    }

    @Test
    void acceptsGraphAndElkKeywords() {
      assertEquals(FlowchartDirection.LR, parse("graph LR").direction());
      assertEquals(FlowchartDirection.TD, parse("flowchart-elk TD").direction());
      assertEquals(FlowchartDirection.BT, parse("flowchart BT;").direction());
    }

    @Test
    void readsTitleFromFrontMatter() {
      FlowchartAst ast = parse("---", "title: \"Order flow\"", "---", "flowchart LR", "  A");
      assertEquals("Order flow", ast.title());
      assertEquals(FlowchartDirection.LR, ast.direction());
    }

    @Test
    void skipsCommentsAndDirectives() {
      FlowchartAst ast =
          parse("%%{init: {\"theme\": \"dark\"}}%%", "flowchart LR", "  %% note", "  A --> B");
      assertEquals(1, ast.links().size());
      assertEquals(List.of("A", "B"), List.copyOf(ast.nodes().keySet()));
    }

    @Test
    void topLevelDirectionStatementOverridesHeader() {
      assertEquals(FlowchartDirection.RL, parse("flowchart LR", "direction RL").direction());
    }
  }

  @Nested
  class Nodes {
    @Test
    void bareIdIsSquareLabelledWithItsId() {
      FlowchartNode node = parse("flowchart LR", "  A").nodes().get("A");
      assertEquals(NodeShape.SQUARE, node.shape());
      assertNull(node.text());
      assertEquals("A", node.label());
    }

    @ParameterizedTest
    @CsvSource(
        delimiter = '|',
        value = {
          "n[Label]       | SQUARE",
          "n(Label)       | ROUND",
          "n((Label))     | CIRCLE",
          "n(((Label)))   | DOUBLECIRCLE",
          "n(-Label-)     | ELLIPSE",
          "n([Label])     | STADIUM",
          "n[[Label]]     | SUBROUTINE",
          "n[(Label)]     | CYLINDER",
          "n{Label}       | DIAMOND",
          "n{{Label}}     | HEXAGON",
          "n>Label]       | ODD",
          "n[/Label\\]    | TRAPEZOID",
          "n[\\Label/]    | INV_TRAPEZOID",
          "n[/Label/]     | LEAN_RIGHT",
          "n[\\Label\\]   | LEAN_LEFT",
        })
    void recognisesEveryShape(String source, NodeShape shape) {
      FlowchartNode node = parse("flowchart LR", source).nodes().get("n");
      assertEquals(shape, node.shape());
      assertEquals("Label", node.text());
    }

    @Test
    void quotedLabelsUnescape() {
      FlowchartAst ast = parse("flowchart LR", "  A[\"say \\\"hi\\\"\\nback\\\\slash\"]");
      assertEquals("say \"hi\"\nback\\slash", ast.nodes().get("A").text());
    }

    @Test
    void quotedLabelsKeepBracketsAndPadding() {
      FlowchartAst ast = parse("flowchart LR", "  A(\" (x) [y] \")");
      assertEquals(NodeShape.ROUND, ast.nodes().get("A").shape());
      assertEquals(" (x) [y] ", ast.nodes().get("A").text());
    }

    @Test
    void unquotedLabelsAreTrimmed() {
      FlowchartNode node = parse("flowchart LR", "  A[  two words  ]").nodes().get("A");
      assertEquals("two words", node.text());
    }

    @Test
    void emptyLabelFallsBackToId() {
      assertNull(parse("flowchart LR", "  A[\"\"]").nodes().get("A").text());
    }

    @Test
    void laterShapeReplacesImplicitOne() {
      FlowchartAst ast = parse("flowchart LR", "  A --> B", "  B{Decide}");
      assertEquals(NodeShape.DIAMOND, ast.nodes().get("B").shape());
      assertEquals("Decide", ast.nodes().get("B").text());
    }

    @Test
    void bareMentionKeepsEarlierShape() {
      FlowchartAst ast = parse("flowchart LR", "  B{Decide}", "  A --> B");
      assertEquals(NodeShape.DIAMOND, ast.nodes().get("B").shape());
    }

    @Test
    void idsMayContainInteriorDashes() {
      FlowchartAst ast = parse("flowchart LR", "  node-a --> node_b");
      assertEquals(FlowchartLink.of("node-a", "node_b"), ast.links().get(0));
    }

    @Test
    void keywordsAreNodeIdsWhenUsedAsNodes() {
      FlowchartAst ast =
          parse("flowchart LR", "  end[End] --> class[Class]", "  style --> o", "  click & x");
      assertEquals(
          List.of("end", "class", "style", "o", "click", "x"), List.copyOf(ast.nodes().keySet()));
      assertEquals(2, ast.links().size());
    }
  }

  @Nested
  class Links {
    @ParameterizedTest
    @CsvSource({
      "-->,   ARROW_POINT,  NORMAL, 1",
      "--->,  ARROW_POINT,  NORMAL, 2",
      "---,   ARROW_OPEN,   NORMAL, 1",
      "-----, ARROW_OPEN,   NORMAL, 3",
      "==>,   ARROW_POINT,  THICK,  1",
      "===,   ARROW_OPEN,   THICK,  1",
      "-.->,  ARROW_POINT,  DOTTED, 1",
      "-..->, ARROW_POINT,  DOTTED, 2",
      "-.-,   ARROW_OPEN,   DOTTED, 1",
      "--o,   ARROW_CIRCLE, NORMAL, 1",
      "--x,   ARROW_CROSS,  NORMAL, 1",
      "o--o,  ARROW_CIRCLE, NORMAL, 1",
      "x==x,  ARROW_CROSS,  THICK,  1",
      "o-.-o, ARROW_CIRCLE, DOTTED, 1",
    })
    void arrowForms(String arrow, LinkType type, LinkStroke stroke, int length) {
      FlowchartLink link = parse("flowchart LR", "  A " + arrow + " B").links().get(0);
      assertEquals(new FlowchartLink("A", "B", type, stroke, length, null), link);
    }

    @Test
    void pipeText() {
      FlowchartAst ast = parse("flowchart LR", "  A -->|yes| B", "  A -->|\"a|b\"| C");
      assertEquals("yes", ast.links().get(0).text());
      assertEquals("a|b", ast.links().get(1).text());
    }

    @Test
    void inlineTextForms() {
      FlowchartAst ast =
          parse("flowchart LR", "  A -- yes --> B", "  B == big ==> C", "  C -. maybe .-> D");
      assertEquals(
          new FlowchartLink("A", "B", LinkType.ARROW_POINT, LinkStroke.NORMAL, 1, "yes"),
          ast.links().get(0));
      assertEquals(
          new FlowchartLink("B", "C", LinkType.ARROW_POINT, LinkStroke.THICK, 1, "big"),
          ast.links().get(1));
      assertEquals(
          new FlowchartLink("C", "D", LinkType.ARROW_POINT, LinkStroke.DOTTED, 1, "maybe"),
          ast.links().get(2));
    }

    @Test
    void chainsProduceOneLinkPerHop() {
      FlowchartAst ast = parse("flowchart LR", "  A --> B --- C ==> D");
      assertEquals(3, ast.links().size());
      assertEquals("C", ast.links().get(2).source());
      assertEquals(LinkStroke.THICK, ast.links().get(2).stroke());
    }

    @Test
    void ampersandGroupsLinkAsCrossProduct() {
      FlowchartAst ast = parse("flowchart LR", "  A & B --> C & D");
      assertEquals(
          List.of(
              FlowchartLink.of("A", "C"),
              FlowchartLink.of("A", "D"),
              FlowchartLink.of("B", "C"),
              FlowchartLink.of("B", "D")),
          ast.links());
    }

    @Test
    void semicolonsSeparateStatements() {
      FlowchartAst ast = parse("flowchart LR; A --> B; B --> C");
      assertEquals(2, ast.links().size());
    }
  }

  @Nested
  class Subgraphs {
    @Test
    void collectsMembersTitleAndDirection() {
      FlowchartAst ast =
          parse(
              "flowchart TB",
              "  subgraph one[First group]",
              "    direction LR",
              "    A --> B",
              "  end",
              "  subgraph two",
              "    C",
              "  end",
              "  B --> C");
      assertEquals(2, ast.subgraphs().size());
      FlowchartSubgraph one = ast.subgraphs().get(0);
      assertEquals("one", one.id());
      assertEquals("First group", one.title());
      assertEquals(FlowchartDirection.LR, one.direction());
      assertEquals(List.of("A", "B"), one.nodes());
      FlowchartSubgraph two = ast.subgraphs().get(1);
      assertNull(two.title());
      assertEquals("two", two.displayTitle());
      assertEquals(List.of("C"), two.nodes());
      assertEquals(FlowchartDirection.TB, ast.direction());
    }

    @Test
    void titleWithSpaceBeforeBracket() {
      FlowchartAst ast = parse("flowchart LR", "subgraph s1 [\"Title\"]", "end");
      FlowchartSubgraph sg = ast.subgraphs().get(0);
      assertEquals("s1", sg.id());
      assertEquals("Title", sg.title());
    }

    @Test
    void generatesIdsForBareTitles() {
      FlowchartAst ast =
          parse("flowchart LR", "subgraph \"Quoted\"", "  A", "end", "subgraph Free text", "end");
      assertEquals("subGraph0", ast.subgraphs().get(0).id());
      assertEquals("Quoted", ast.subgraphs().get(0).title());
      assertEquals("subGraph1", ast.subgraphs().get(1).id());
      assertEquals("Free text", ast.subgraphs().get(1).title());
    }

    @Test
    void nestedSubgraphsAreFlattenedInClosingOrder() {
      FlowchartAst ast =
          parse(
              "flowchart LR",
              "  subgraph outer",
              "    A",
              "    subgraph inner",
              "      B --> A",
              "    end",
              "  end");
      assertEquals(
          List.of("inner", "outer"), ast.subgraphs().stream().map(FlowchartSubgraph::id).toList());
      assertEquals(List.of("B"), ast.subgraphs().get(0).nodes());
      assertEquals(List.of("A"), ast.subgraphs().get(1).nodes());
    }

    @Test
    void nodesOutsideBlocksStayUnowned() {
      FlowchartAst ast = parse("flowchart LR", "  A", "  subgraph s", "    B", "  end", "  C");
      assertEquals(List.of("B"), ast.subgraphs().get(0).nodes());
    }
  }

  @Nested
  class Statements {
    @Test
    void classDefinitionsAndAssignments() {
      FlowchartAst ast =
          parse(
              "flowchart LR",
              "  A:::hot --> B",
              "  classDef hot fill:#f96,stroke:#333",
              "  classDef cold,frozen color:blue",
              "  class A,B cold");
      assertEquals(List.of("hot", "cold"), ast.classes().get("A"));
      assertEquals(List.of("cold"), ast.classes().get("B"));
      assertEquals(Map.of("fill", "#f96", "stroke", "#333"), ast.classDefs().get("hot").styles());
      assertEquals(Map.of("color", "blue"), ast.classDefs().get("frozen").styles());
    }

    @Test
    void inlineClassListForms() {
      FlowchartAst ast = parse("flowchart LR", "  A[x]:::a,b", "  B:::c:::d");
      assertEquals(List.of("a", "b"), ast.classes().get("A"));
      assertEquals(List.of("c", "d"), ast.classes().get("B"));
    }

    @Test
    void nodeStylesKeepParenthesisedCommas() {
      FlowchartAst ast = parse("flowchart LR", "  A", "  style A fill:rgb(1,2,3),stroke-width:4px");
      assertEquals(
          Map.of("fill", "rgb(1,2,3)", "stroke-width", "4px"), ast.nodeStyles().get("A"));
    }

    @Test
    void clickForms() {
      FlowchartAst ast =
          parse(
              "flowchart LR",
              "  A & B & C & D",
              "  click A href \"https://example.com\" \"Docs\" _blank",
              "  click B call show(1, 2) \"Run\"",
              "  click C handler",
              "  click D \"https://example.org\"");
      List<FlowchartClick> clicks = ast.clicks();
      assertEquals(
          new FlowchartClick("A", "https://example.com", null, null, "_blank", "Docs"),
          clicks.get(0));
      assertEquals(new FlowchartClick("B", null, "show", "1, 2", null, "Run"), clicks.get(1));
      assertEquals(FlowchartClick.callback("C", "handler", null), clicks.get(2));
      assertEquals(FlowchartClick.href("D", "https://example.org"), clicks.get(3));
    }

    @Test
    void lastClickForANodeWins() {
      FlowchartAst ast =
          parse("flowchart LR", "  A", "  click A call first()", "  click A call second");
      assertEquals(List.of(FlowchartClick.callback("A", "second", "")), ast.clicks());
    }

    @Test
    void linkStyles() {
      FlowchartAst ast =
          parse(
              "flowchart LR",
              "  A --> B --> C",
              "  linkStyle default stroke:#ff3",
              "  linkStyle 0,1 interpolate basis stroke:red,stroke-width:2px");
      List<FlowchartLinkStyle> styles = ast.linkStyles();
      assertEquals(3, styles.size());
      assertTrue(styles.get(0).isDefault());
      assertNull(styles.get(0).interpolate());
      assertEquals(1, styles.get(2).index());
      assertEquals("basis", styles.get(2).interpolate());
      assertEquals(Map.of("stroke", "red", "stroke-width", "2px"), styles.get(2).styles());
    }

    @Test
    void accessibility() {
      FlowchartAst ast =
          parse(
              "flowchart LR",
              "  accTitle: Order flow",
              "  accDescr {",
              "    Orders move",
              "    left to right",
              "  }",
              "  A");
      assertEquals("Order flow", ast.title());
      assertEquals("Orders move\nleft to right", ast.accDescription());
      assertEquals("Short", parse("flowchart LR", "accDescr: Short").accDescription());
    }

    @Test
    void accessibilityKeywordsCanBeNodeIds() {
      FlowchartAst ast =
          parse("flowchart TD", "  accDescr{accDescr} --> accTitle{{T}}", "  accDescr:::hot");
      assertEquals(List.of("accDescr", "accTitle"), List.copyOf(ast.nodes().keySet()));
      assertEquals(NodeShape.DIAMOND, ast.nodes().get("accDescr").shape());
      assertEquals(NodeShape.HEXAGON, ast.nodes().get("accTitle").shape());
      assertEquals(List.of("hot"), ast.classes().get("accDescr"));
      assertEquals(1, ast.links().size());
      assertNull(ast.title());
      assertNull(ast.accDescription());
    }

    @Test
    void descriptionBlockOpeners() {
      assertEquals("text", parse("flowchart TD", "accDescr{", "  text", "}").accDescription());
      assertEquals("inline", parse("flowchart TD", "accDescr { inline }").accDescription());
      assertTrue(parse("flowchart TD", "accDescr{", "  text", "}").nodes().isEmpty());
    }
  }

  @Nested
  class Errors {
    private DiagramParseException fails(String... lines) {
      return assertThrows(DiagramParseException.class, () -> parse(lines));
    }

    @Test
    void emptyInput() {
      assertEquals("Empty flowchart", fails("  ", "").getMessage());
    }

    @Test
    void otherDiagramKinds() {
      DiagramParseException e = fails("sequenceDiagram", "  A->>B: hi");
      assertTrue(e.getMessage().startsWith("Expected 'flowchart' or 'graph' header"));
      assertEquals(1, e.line());
      assertEquals(1, e.column());
    }

    @Test
    void unknownDirection() {
      DiagramParseException e = fails("flowchart SIDEWAYS");
      assertTrue(e.getMessage().startsWith("Unknown direction 'SIDEWAYS'"));
      assertEquals(11, e.column());
      assertEquals("SIDEWAYS", e.fragment());
    }

    @Test
    void unterminatedLabel() {
      DiagramParseException e = fails("flowchart LR", "  A[unclosed");
      assertTrue(e.getMessage().startsWith("Unterminated node label"));
      assertEquals(2, e.line());
      assertEquals(4, e.column());
    }

    @Test
    void unterminatedQuotedLabel() {
      DiagramParseException e = fails("flowchart LR", "  A[\"open] --> B");
      assertTrue(e.getMessage().startsWith("Unterminated quoted string"));
      assertEquals(2, e.line());
      assertEquals(5, e.column());
    }

    @Test
    void unterminatedSubgraph() {
      DiagramParseException e = fails("flowchart LR", "  subgraph one", "    A");
      assertTrue(e.getMessage().startsWith("Unterminated subgraph 'one'"));
      assertEquals(2, e.line());
      assertEquals(3, e.column());
    }

    @Test
    void strayEnd() {
      DiagramParseException e = fails("flowchart LR", "  A", "end");
      assertTrue(e.getMessage().startsWith("Unexpected 'end'"));
      assertEquals(3, e.line());
      assertEquals(1, e.column());
    }

    @Test
    void bidirectionalLinks() {
      DiagramParseException e = fails("flowchart LR", "  A <--> B");
      assertTrue(e.getMessage().startsWith("Bidirectional links are not supported"));
      assertEquals(5, e.column());
    }

    @Test
    void trailingGarbage() {
      DiagramParseException e = fails("flowchart LR", "  A[x] ]");
      assertTrue(e.getMessage().startsWith("Unexpected input"));
      assertEquals(8, e.column());
    }

    @Test
    void clickTargetWithQuote() {
      DiagramParseException e = fails("flowchart LR", "  click A href \"u\" bad\"t");
      assertTrue(e.getMessage().startsWith("Invalid link target"));
      assertEquals(2, e.line());
      assertEquals(9, e.column());
    }
  }
}
