package io.mermaidast.flowchart.api;

import java.util.Locale;

/** Layout direction. {@code TB} and {@code TD} mean the same but are kept as written. */
public enum FlowchartDirection {
  LR,
  RL,
  TB,
  TD,
  BT;

  /** Parses a direction token, case-insensitively. Returns {@code null} if not recognised. */
  public static FlowchartDirection fromToken(String token) {
    if (token == null) {
      return null;
    }
    return switch (token.toUpperCase(Locale.ROOT)) {
      case "LR" -> LR;
      case "RL" -> RL;
      case "TB" -> TB;
      case "TD" -> TD;
      case "BT" -> BT;
      default -> null;
    };
  }
}
