package io.mermaidast.flowchart.api;

import java.util.List;
import java.util.Objects;

/**
 * An interaction bound to a node: either a link ({@code href}) or a callback.
 *
 * @param callbackArgs raw argument text between the parentheses of {@code call cb(...)}, or
 *     {@code null} for a bare callback name
 * @param target link target such as {@code _blank}, or {@code null}
 */
public record FlowchartClick(
    String nodeId,
    String href,
    String callback,
    String callbackArgs,
    String target,
    String tooltip) {

  private static final List<String> KEYWORDS = List.of("href", "call");

  public FlowchartClick {
    Objects.requireNonNull(nodeId, "nodeId must not be null");
    if ((href == null) == (callback == null)) {
      throw new IllegalArgumentException("exactly one of href and callback must be set");
    }
    if (callback != null) {
      if (!isCallbackName(callback)) {
        throw new IllegalArgumentException("Invalid callback name: '" + callback + "'");
      }
      if (callbackArgs == null && startsWithKeyword(callback)) {
        throw new IllegalArgumentException(
            "Callback '" + callback + "' needs arguments to be told apart from a keyword");
      }
    }
    if (callbackArgs != null
        && callbackArgs.chars().anyMatch(c -> c == ')' || c == '\n' || c == '\r')) {
      throw new IllegalArgumentException(
          "Callback arguments must not contain ')' or line breaks: '" + callbackArgs + "'");
    }
    if (target != null
        && (target.isEmpty()
            || target.chars().anyMatch(c -> Character.isWhitespace(c) || c == ';' || c == '"'))) {
      throw new IllegalArgumentException("Invalid link target: '" + target + "'");
    }
  }

  /** Letters, digits, {@code _}, {@code .} and {@code $}. */
  public static boolean isCallbackName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!FlowchartNode.isIdChar(c) && c != '.' && c != '$') {
        return false;
      }
    }
    return true;
  }

  // a bare "href" or "call" (or "call.x") reads as the keyword of another click form
  private static boolean startsWithKeyword(String name) {
    for (String keyword : KEYWORDS) {
      if (name.startsWith(keyword)
          && (name.length() == keyword.length()
              || !FlowchartNode.isIdChar(name.charAt(keyword.length())))) {
        return true;
      }
    }
    return false;
  }

  public static FlowchartClick href(String nodeId, String href) {
    return new FlowchartClick(nodeId, href, null, null, null, null);
  }

  public static FlowchartClick callback(String nodeId, String callback, String args) {
    return new FlowchartClick(nodeId, null, callback, args, null, null);
  }

  public boolean isHref() {
    return href != null;
  }
}
