package com.termdag.engine;

import com.termdag.api.CycleFoundException;
import com.termdag.api.GlyphStyle;
import com.termdag.io.EdgeListParser;
import com.termdag.screen.Screen;

import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.*;

public class LayoutEngineTest {

    @Test
    public void testEmptyGraph() {
        assertEquals("", new LayoutEngine().render(new GraphContext()));
    }

    @Test
    public void testSingleVertex() {
        GraphContext ctx = new GraphContext();
        ctx.addVertex("A");
        assertEquals("┌───┐\n│ A │\n└───┘\n", new LayoutEngine().render(ctx));
    }

    @Test
    public void testRasterizeAppliesGlyphStyle() {
        GraphContext ctx = EdgeListParser.parse("A -> B");
        LayoutEngine engine = new LayoutEngine(LayoutConfig.defaults().withGlyphStyle(GlyphStyle.ASCII));
        engine.layout(ctx);
        Screen screen = engine.rasterize(ctx);

        assertEquals(5, screen.width());
        assertEquals(6, screen.height());
        assertEquals(".---.\n| A |\n'---'\n.V--.\n| B |\n'---'\n", screen.stringify());
    }

    @Test
    public void testRandomGraphsStayConsistent() {
        Random random = new Random(42);
        LayoutEngine engine = new LayoutEngine();
        for (int graph = 0; graph < 200; graph++) {
            int vertices = 2 + random.nextInt(12);
            int edges = random.nextInt(2 * vertices);
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < edges; i++) {
                int a = random.nextInt(vertices);
                int b = random.nextInt(vertices);
                if (a == b)
                    continue;
                // lower index always points down, so the graph stays acyclic
                text.append('n').append(Math.min(a, b))
                        .append(" -> n").append(Math.max(a, b)).append('\n');
            }
            if (text.length() == 0)
                continue;

            GraphContext ctx = EdgeListParser.parse(text.toString());
            String first;
            try {
                first = engine.render(ctx);
            } catch (CycleFoundException e) {
                fail("Acyclic input rejected: " + text);
                return;
            }
            assertTrue(text.toString(), Layering.isProper(ctx));
            assertTrue(text.toString(), RowOrdering.rowsArePermutation(ctx));
            assertTrue(text.toString(), GeometrySolver.isConsistent(ctx));
            assertEquals(first, engine.render(EdgeListParser.parse(text.toString())));
        }
    }
}
