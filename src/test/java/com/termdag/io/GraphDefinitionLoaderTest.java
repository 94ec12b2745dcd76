package com.termdag.io;

import com.termdag.api.GlyphStyle;
import com.termdag.engine.GraphContext;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import static org.junit.Assert.*;

public class GraphDefinitionLoaderTest {

    @Test
    public void testLoadFromFile() throws Exception {
        Path path = Paths.get(getClass().getResource("/build.json").toURI());
        GraphDefinition def = GraphDefinitionLoader.parseFile(path);

        assertEquals("build", def.getGraph().getName());
        assertEquals(4, def.getGraph().getNodes().size());
        assertEquals("ship it", def.getGraph().getNodes().get(3).getDescription());

        GraphContext ctx = GraphDefinitionLoader.toContext(def);
        assertEquals(4, ctx.vertexCount());
        assertTrue(ctx.vertex("compile").downward().contains(ctx.indexOf("test")));
        assertTrue(ctx.vertex("deploy").upward().contains(ctx.indexOf("package")));
    }

    @Test
    public void testUndeclaredDependencyIsAdded() {
        GraphDefinition def = GraphDefinitionLoader.parse(
                "{\"graph\": {\"name\": \"g\", \"nodes\": [{\"name\": \"b\", \"dependencies\": [\"a\"]}]}}");
        GraphContext ctx = GraphDefinitionLoader.toContext(def);

        assertEquals(2, ctx.vertexCount());
        assertTrue(ctx.vertex("a").downward().contains(ctx.indexOf("b")));
    }

    @Test
    public void testDescribedNodes() {
        GraphDefinition def = GraphDefinitionLoader.parse("{\"graph\": {\"name\": \"g\", \"nodes\": ["
                + "{\"name\": \"fetch\", \"description\": \"pull sources\"},"
                + "{\"name\": \"build\", \"description\": \"compile\", \"dependencies\": [\"fetch\"]}]}}");

        assertEquals("pull sources", def.getGraph().getNodes().get(0).getDescription());
        GraphContext ctx = GraphDefinitionLoader.toContext(def);
        assertEquals(2, ctx.vertexCount());
        assertTrue(ctx.vertex("fetch").downward().contains(ctx.indexOf("build")));
    }

    @Test
    public void testStyle() {
        GraphDefinition plain = GraphDefinitionLoader.parse("{\"graph\": {\"name\": \"g\"}}");
        GraphDefinition ascii = GraphDefinitionLoader.parse("{\"graph\": {\"name\": \"g\", \"style\": \"ascii_rounded\"}}");

        assertEquals(GlyphStyle.UNICODE, GraphDefinitionLoader.styleOf(plain, GlyphStyle.UNICODE));
        assertEquals(GlyphStyle.ASCII_ROUNDED, GraphDefinitionLoader.styleOf(ascii, GlyphStyle.UNICODE));
        assertTrue(GraphDefinitionLoader.toContext(plain).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownStyle() {
        GraphDefinition def = GraphDefinitionLoader.parse("{\"graph\": {\"name\": \"g\", \"style\": \"fancy\"}}");
        GraphDefinitionLoader.styleOf(def, GlyphStyle.UNICODE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingGraphKey() {
        GraphDefinitionLoader.parse("{\"nodes\": []}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnnamedNode() {
        GraphDefinition def = GraphDefinitionLoader.parse("{\"graph\": {\"nodes\": [{\"description\": \"x\"}]}}");
        GraphDefinitionLoader.toContext(def);
    }

    @Test(expected = UncheckedIOException.class)
    public void testMalformedJson() {
        GraphDefinitionLoader.parse("{\"graph\": ");
    }
}
