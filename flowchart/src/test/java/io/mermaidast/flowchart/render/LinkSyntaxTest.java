package io.mermaidast.flowchart.render;

import static org.junit.jupiter.api.Assertions.*;

import io.mermaidast.flowchart.api.FlowchartLink;
import io.mermaidast.flowchart.api.LinkStroke;
import io.mermaidast.flowchart.api.LinkType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LinkSyntaxTest {

  @ParameterizedTest
  @CsvSource({
    "ARROW_POINT,  NORMAL, 1, -->",
    "ARROW_POINT,  NORMAL, 3, ---->",
    "ARROW_OPEN,   NORMAL, 1, ---",
    "ARROW_OPEN,   NORMAL, 2, ----",
    "ARROW_POINT,  THICK,  1, ==>",
    "ARROW_OPEN,   THICK,  1, ===",
    "ARROW_POINT,  DOTTED, 1, -.->",
    "ARROW_POINT,  DOTTED, 3, -.->",
    "ARROW_OPEN,   DOTTED, 1, -.-",
    "ARROW_CIRCLE, NORMAL, 1, o--o",
    "ARROW_CROSS,  NORMAL, 1, x--x",
    "ARROW_CIRCLE, THICK,  2, o===o",
    "ARROW_CROSS,  DOTTED, 1, x-.-x",
  })
  void arrows(LinkType type, LinkStroke stroke, int length, String expected) {
    assertEquals(expected, LinkSyntax.arrow(type, stroke, length));
  }

  @Test
  void textIsPipedAndQuotedWhenNeeded() {
    FlowchartLink link = FlowchartLink.of("A", "B").withText("yes");
    assertEquals("-->|yes|", LinkSyntax.render(link));
    assertEquals("-->|\"a|b\"|", LinkSyntax.render(link.withText("a|b")));
    assertEquals("-->", LinkSyntax.render(link.withText(null)));
  }
}
