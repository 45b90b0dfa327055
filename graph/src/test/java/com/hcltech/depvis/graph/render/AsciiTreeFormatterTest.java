package com.hcltech.depvis.graph.render;

import org.junit.jupiter.api.Test;

import static com.hcltech.depvis.graph.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class AsciiTreeFormatterTest {

    @Test
    void unicodeDiamond() {
        String text = new AsciiTreeFormatter().format(TreeRenderer.render(graph(DIAMOND), "A"));
        assertEquals(String.join("\n",
                "A",
                "├─ B",
                "│  └─ D",
                "└─ C",
                "   ├─ D",
                "   └─ E"), text);
    }

    @Test
    void unicodeTriangleShowsCycleMarker() {
        String text = new AsciiTreeFormatter().format(TreeRenderer.render(graph(TRIANGLE), "A"));
        assertEquals(String.join("\n",
                "A",
                "└─ B",
                "   └─ C",
                "      └─ A (cycle detected)"), text);
    }

    @Test
    void asciiStyleAndCustomMarker() {
        var formatter = new AsciiTreeFormatter(TreeStyle.ASCII, "[cycle]");
        String text = formatter.format(TreeRenderer.render(graph("A: B C", "B: A", "C:"), "A"));
        assertEquals(String.join("\n",
                "A",
                "+- B",
                "|  \\- A [cycle]",
                "\\- C"), text);
    }

    @Test
    void indentStyleOnlyIndents() {
        var formatter = new AsciiTreeFormatter(TreeStyle.INDENT, AsciiTreeFormatter.DEFAULT_CYCLE_MARKER);
        String text = formatter.format(TreeRenderer.render(graph("A: B", "B: C", "C:"), "A"));
        assertEquals("A\n   B\n      C", text);
    }

    @Test
    void singleNode() {
        assertEquals("X", new AsciiTreeFormatter().format(TreeRenderer.render(graph("X:"), "X")));
    }
}
