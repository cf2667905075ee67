package io.mermaidast.core.api;

import java.util.List;
import java.util.Locale;

/** Diagram families recognised from the first significant line of their source text. */
public enum DiagramKind {
  FLOWCHART("flowchart", "flowchart-elk", "graph"),
  SEQUENCE("sequenceDiagram"),
  CLASS("classDiagram", "classDiagram-v2"),
  STATE("stateDiagram", "stateDiagram-v2"),
  ER("erDiagram"),
  C4("C4Context", "C4Container", "C4Component", "C4Dynamic", "C4Deployment"),
  GANTT("gantt"),
  JOURNEY("journey"),
  KANBAN("kanban"),
  MINDMAP("mindmap"),
  PIE("pie"),
  REQUIREMENT("requirementDiagram"),
  SANKEY("sankey-beta", "sankey"),
  TIMELINE("timeline"),
  XY_CHART("xychart-beta", "xychart"),
  BLOCK("block-beta", "block"),
  QUADRANT("quadrantChart"),
  GIT_GRAPH("gitGraph"),
  UNKNOWN();

  private final List<String> keywords;

  DiagramKind(String... keywords) {
    this.keywords = List.of(keywords);
  }

  public List<String> keywords() {
    return keywords;
  }

  /**
   * Detects the diagram family of {@code text}. Blank lines, {@code %%} comments and directives,
   * and a leading {@code ---} front-matter block are skipped.
   *
   * @return the detected kind, or {@link #UNKNOWN}
   */
  public static DiagramKind detect(String text) {
    if (text == null) {
      return UNKNOWN;
    }
    String[] lines = text.split("\r?\n", -1);
    boolean frontMatterAllowed = true;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].trim();
      if (line.isEmpty() || line.startsWith("%%")) {
        continue;
      }
      if (frontMatterAllowed && line.equals("---")) {
        i++;
        while (i < lines.length && !lines[i].trim().equals("---")) {
          i++;
        }
        frontMatterAllowed = false;
        continue;
      }
      return fromKeyword(firstWord(line));
    }
    return UNKNOWN;
  }

  private static String firstWord(String line) {
    int end = 0;
    while (end < line.length()
        && !Character.isWhitespace(line.charAt(end))
        && line.charAt(end) != ';'
        && line.charAt(end) != ':') {
      end++;
    }
    return line.substring(0, end);
  }

  private static DiagramKind fromKeyword(String word) {
    String lower = word.toLowerCase(Locale.ROOT);
    for (DiagramKind kind : values()) {
      for (String k : kind.keywords) {
        if (k.toLowerCase(Locale.ROOT).equals(lower)) {
          return kind;
        }
      }
    }
    return UNKNOWN;
  }
}
