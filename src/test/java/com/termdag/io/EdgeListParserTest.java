package com.termdag.io;

import com.termdag.engine.GraphContext;

import org.junit.Test;

import static org.junit.Assert.*;

public class EdgeListParserTest {

    @Test
    public void testChains() {
        GraphContext ctx = EdgeListParser.parse("A -> B -> C\nD -> C");

        assertEquals(4, ctx.vertexCount());
        assertEquals(0, ctx.indexOf("A"));
        assertEquals(3, ctx.indexOf("D"));
        assertTrue(ctx.vertex("B").downward().contains(ctx.indexOf("C")));
        assertTrue(ctx.vertex("C").upward().contains(ctx.indexOf("D")));
    }

    @Test
    public void testWhitespaceAndBlankLines() {
        GraphContext ctx = EdgeListParser.parse("\n   \n  Build  ->   Test runner \n\n");

        assertEquals(2, ctx.vertexCount());
        assertTrue(ctx.contains("Build"));
        assertTrue(ctx.contains("Test runner"));
    }

    @Test
    public void testIsolatedName() {
        GraphContext ctx = EdgeListParser.parse("Solo");
        assertEquals(1, ctx.vertexCount());
        assertTrue(ctx.vertex("Solo").downward().isEmpty());
    }

    @Test
    public void testEmptyInput() {
        assertTrue(EdgeListParser.parse("").isEmpty());
        assertTrue(EdgeListParser.parse("  \n\t\n").isEmpty());
    }

    @Test
    public void testParseIntoExistingContext() {
        GraphContext ctx = new GraphContext();
        ctx.addVertex("Z");
        EdgeListParser.parseInto("A -> Z", ctx);

        assertEquals(0, ctx.indexOf("Z"));
        assertTrue(ctx.vertex("Z").upward().contains(ctx.indexOf("A")));
    }
}
