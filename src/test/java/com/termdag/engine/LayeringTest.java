package com.termdag.engine;

import com.termdag.api.CycleFoundException;
import com.termdag.io.EdgeListParser;

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

public class LayeringTest {

    @Test
    public void testLinearChain() {
        GraphContext ctx = EdgeListParser.parse("A -> B -> C");
        Layering.assignLayers(ctx);

        assertEquals(0, ctx.vertex("A").layer());
        assertEquals(1, ctx.vertex("B").layer());
        assertEquals(2, ctx.vertex("C").layer());
    }

    @Test
    public void testLongestPathWins() {
        // C sits below D even though A -> C is direct
        GraphContext ctx = EdgeListParser.parse("A -> C\nA -> D -> C\nB -> D\nE -> C");
        Layering.assignLayers(ctx);

        assertEquals(0, ctx.vertex("A").layer());
        assertEquals(0, ctx.vertex("B").layer());
        assertEquals(0, ctx.vertex("E").layer());
        assertEquals(1, ctx.vertex("D").layer());
        assertEquals(2, ctx.vertex("C").layer());
    }

    @Test(expected = CycleFoundException.class)
    public void testCycleDetection() {
        GraphContext ctx = EdgeListParser.parse("A -> B\nA -> D\nB -> D\nD -> E\nE -> A");
        Layering.assignLayers(ctx);
    }

    @Test(expected = CycleFoundException.class)
    public void testSelfLoopDetection() {
        GraphContext ctx = EdgeListParser.parse("A -> A");
        Layering.assignLayers(ctx);
    }

    @Test
    public void testCycleReportsVertexCount() {
        GraphContext ctx = EdgeListParser.parse("A -> B -> C -> A");
        try {
            Layering.assignLayers(ctx);
            fail("Should have detected the cycle");
        } catch (CycleFoundException e) {
            assertEquals(3, e.vertexCount());
            assertTrue(e.passes() > 9);
            assertTrue(e.getMessage().contains("cycle"));
        }
    }

    @Test
    public void testCompletionInsertsConnectors() {
        GraphContext ctx = EdgeListParser.parse("A -> B -> C\nA -> C");
        Layering.assignLayers(ctx);
        assertFalse(Layering.isProper(ctx));

        int inserted = Layering.complete(ctx);

        assertEquals(1, inserted);
        assertEquals(4, ctx.vertexCount());
        Vertex connector = ctx.vertex(3);
        assertTrue(connector.isConnector());
        assertEquals(1, connector.layer());
        assertTrue(ctx.vertex("A").downward().contains(3));
        assertTrue(ctx.vertex("C").upward().contains(3));
        assertTrue(Layering.isProper(ctx));
    }

    @Test
    public void testCompletionOfLongSpan() {
        // A -> E spans four layers and needs three connectors
        GraphContext ctx = EdgeListParser.parse("A -> B -> C -> D -> E\nA -> E");
        Layering.assignLayers(ctx);

        assertEquals(3, Layering.complete(ctx));
        assertTrue(Layering.isProper(ctx));
    }

    @Test
    public void testBuildLayersAndEdges() {
        GraphContext ctx = EdgeListParser.parse("A -> B\nA -> C");
        Layering.assignLayers(ctx);
        Layering.complete(ctx);
        Layering.buildLayers(ctx);
        Layering.buildEdges(ctx);

        assertEquals(2, ctx.layers().size());
        assertEquals(List.of(0), ctx.layer(0).vertices());
        assertEquals(List.of(1, 2), ctx.layer(1).vertices());
        assertEquals(2, ctx.layer(0).edges().size());
        assertTrue(ctx.layer(1).edges().isEmpty());
        for (Edge e : ctx.layer(0).edges())
            assertEquals(ctx.vertex(e.up()).layer() + 1, ctx.vertex(e.down()).layer());
    }
}
