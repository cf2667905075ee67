package io.mermaidast.flowchart.analysis;

import static org.junit.jupiter.api.Assertions.*;

import io.mermaidast.flowchart.api.FlowchartAst;
import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.parser.FlowchartParser;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GraphQueriesTest {

  private static FlowchartAst diamond() {
    return FlowchartParser.parse("flowchart LR\n  A --> B --> C\n  A --> D --> C\n  E");
  }

  @Test
  void reachableIsBreadthFirstAndIncludesStart() {
    assertEquals(List.of("A", "B", "D", "C"), GraphQueries.reachable(diamond(), "A"));
    assertEquals(List.of("E"), GraphQueries.reachable(diamond(), "E"));
  }

  @Test
  void ancestorsFollowLinksBackwards() {
    assertEquals(List.of("C", "B", "D", "A"), GraphQueries.ancestors(diamond(), "C"));
    assertEquals(List.of("A"), GraphQueries.ancestors(diamond(), "A"));
  }

  @Test
  void unknownStartYieldsItself() {
    assertEquals(List.of("nope"), GraphQueries.reachable(diamond(), "nope"));
  }

  @Test
  void shortestPathFollowsExistingLinks() {
    FlowchartAst ast = diamond();
    List<String> path = GraphQueries.shortestPath(ast, "A", "C");
    assertEquals(List.of("A", "B", "C"), path);
    for (int i = 0; i + 1 < path.size(); i++) {
      String source = path.get(i);
      String target = path.get(i + 1);
      assertTrue(ast.links().stream().anyMatch(l -> l.connects(source, target)));
    }
  }

  @Test
  void pathToSelfIsSingleNode() {
    assertEquals(List.of("A"), GraphQueries.shortestPath(diamond(), "A", "A"));
  }

  @Test
  void unreachableTargetGivesEmptyPath() {
    assertEquals(List.of(), GraphQueries.shortestPath(diamond(), "A", "E"));
    assertEquals(List.of(), GraphQueries.shortestPath(diamond(), "C", "A"));
  }

  @Test
  void shortestPathPrefersFewerHops() {
    FlowchartAst ast = FlowchartParser.parse("flowchart LR\n  A --> B --> C --> D\n  A --> D");
    assertEquals(List.of("A", "D"), GraphQueries.shortestPath(ast, "A", "D"));
  }

  @Test
  void linearChainReturnsWholeRun() {
    FlowchartAst ast = FlowchartParser.parse("flowchart LR\n  A --> B --> C --> D");
    assertEquals(List.of("A", "B", "C", "D"), GraphQueries.linearChain(ast, "A", "D"));
    assertEquals(List.of("B", "C"), GraphQueries.linearChain(ast, "B", "C"));
    assertEquals(List.of("C"), GraphQueries.linearChain(ast, "C", "C"));
  }

  @Test
  void branchInsideTheRunBreaksTheChain() {
    FlowchartAst ast = FlowchartParser.parse("flowchart LR\n  A --> B --> C --> D");
    ast.links().add(FlowchartLink.of("B", "X"));
    assertEquals(List.of(), GraphQueries.linearChain(ast, "A", "D"));
  }

  @Test
  void chainThatMissesTheEndIsEmpty() {
    FlowchartAst ast = FlowchartParser.parse("flowchart LR\n  A --> B --> C\n  D");
    assertEquals(List.of(), GraphQueries.linearChain(ast, "A", "D"));
    assertEquals(List.of(), GraphQueries.linearChain(ast, "C", "A"));
  }

  @Test
  void cyclesTerminate() {
    FlowchartAst ast = FlowchartParser.parse("flowchart LR\n  A --> B --> A\n  Z");
    assertEquals(List.of(), GraphQueries.linearChain(ast, "A", "Z"));
  }

  @Test
  void adjacencyCountsParallelLinks() {
    FlowchartAst ast = FlowchartParser.parse("flowchart LR\n  A --> B\n  A -.-> B\n  C --> B");
    assertEquals(Map.of("A", List.of("B", "B"), "C", List.of("B")),
        GraphQueries.adjacency(ast.links(), true));
    assertEquals(Map.of("B", List.of("A", "A", "C")), GraphQueries.adjacency(ast.links(), false));
  }
}
