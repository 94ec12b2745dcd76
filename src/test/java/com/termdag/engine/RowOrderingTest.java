package com.termdag.engine;

import com.termdag.io.EdgeListParser;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.Test;

import static org.junit.Assert.*;

public class RowOrderingTest {

    private static GraphContext ordered(String text) {
        GraphContext ctx = EdgeListParser.parse(text);
        Layering.assignLayers(ctx);
        Layering.complete(ctx);
        Layering.buildLayers(ctx);
        new RowOrdering(LayoutConfig.defaults().getParentWeight()).order(ctx);
        Layering.buildEdges(ctx);
        return ctx;
    }

    @Test
    public void testRowsFormPermutation() {
        GraphContext ctx = ordered("A -> B -> C\nD -> C\nD -> E\nF -> E\nA -> E");
        assertTrue(RowOrdering.rowsArePermutation(ctx));
    }

    @Test
    public void testDocumentedExampleOrder() {
        GraphContext ctx = ordered("A -> B -> C\nD -> C\nD -> E");

        assertEquals(List.of(List.of("A", "D"), List.of("B", "|", "E"), List.of("C")),
                Layering.describe(ctx));
    }

    @Test
    public void testChildrenFollowParents() {
        // P and Q are registered first, so index order would cross the edges
        GraphContext ctx = ordered("P\nQ\nA -> Q\nB -> P");

        assertEquals(List.of(List.of("A", "B"), List.of("Q", "P")), Layering.describe(ctx));
        assertEquals(0, ctx.vertex("Q").row());
        assertEquals(1, ctx.vertex("P").row());
    }

    @Test
    public void testClosures() {
        GraphContext ctx = ordered("A -> B -> C\nA -> D");

        assertEquals(indices(ctx, "B", "C", "D"), ctx.vertex("A").downwardClosure());
        assertEquals(indices(ctx, "C"), ctx.vertex("B").downwardClosure());
        assertTrue(ctx.vertex("C").downwardClosure().isEmpty());
    }

    @Test
    public void testDistanceToCommonDescendant() {
        GraphContext ctx = ordered("A -> C\nB -> C\nD -> E");
        Layer top = ctx.layer(0);
        int[][] distance = RowOrdering.distances(ctx, top);

        int a = top.vertices().indexOf(ctx.indexOf("A"));
        int b = top.vertices().indexOf(ctx.indexOf("B"));
        int d = top.vertices().indexOf(ctx.indexOf("D"));
        assertEquals(1, distance[a][b]);
        assertEquals(ctx.vertexCount() * 2, distance[a][d]);
    }

    private static Set<Integer> indices(GraphContext ctx, String... labels) {
        Set<Integer> out = new TreeSet<>();
        for (String label : labels)
            out.add(ctx.indexOf(label));
        return out;
    }
}
