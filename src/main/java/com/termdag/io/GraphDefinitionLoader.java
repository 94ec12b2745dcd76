package com.termdag.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termdag.api.GlyphStyle;
import com.termdag.engine.GraphContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads {@link GraphDefinition} JSON and registers it into a
 * {@link GraphContext}.
 */
public final class GraphDefinitionLoader {
    private static final Logger log = LogManager.getLogger(GraphDefinitionLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphDefinitionLoader() {
        // Utility class
    }

    /** Parses a JSON file into a GraphDefinition. */
    public static GraphDefinition parseFile(Path path) throws IOException {
        return validate(MAPPER.readValue(Files.readString(path), GraphDefinition.class));
    }

    /** Parses a JSON string into a GraphDefinition. */
    public static GraphDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, GraphDefinition.class));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed graph definition", e);
        }
    }

    private static GraphDefinition validate(GraphDefinition def) {
        if (def == null || def.getGraph() == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        return def;
    }

    /**
     * Registers every node, then every dependency edge. Dependencies may name
     * nodes declared later in the list, or not declared at all.
     */
    public static GraphContext toContext(GraphDefinition def) {
        GraphContext ctx = new GraphContext();
        var info = def.getGraph();
        if (info.getNodes() == null)
            return ctx;
        for (var node : info.getNodes()) {
            if (node.getName() == null || node.getName().isBlank())
                throw new IllegalArgumentException("Node without a name in graph " + info.getName());
            ctx.addVertex(node.getName().trim());
            if (node.getDescription() != null)
                log.debug("Node '{}': {}", node.getName(), node.getDescription());
        }
        for (var node : info.getNodes()) {
            if (node.getDependencies() == null)
                continue;
            for (String dep : node.getDependencies()) {
                String parent = dep.trim();
                if (!ctx.contains(parent))
                    log.debug("Dependency '{}' of '{}' is not declared, adding it", parent, node.getName());
                ctx.addVertex(parent);
                ctx.addEdge(parent, node.getName().trim());
            }
        }
        return ctx;
    }

    /** The style named by the definition, or {@code fallback} if none is given. */
    public static GlyphStyle styleOf(GraphDefinition def, GlyphStyle fallback) {
        String style = def.getGraph().getStyle();
        if (style == null || style.isBlank())
            return fallback;
        try {
            return GlyphStyle.valueOf(style.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown style '" + style + "' in graph " + def.getGraph().getName(), e);
        }
    }
}
