package com.termdag.io;

import com.termdag.engine.GraphContext;

/**
 * Reads the arrow-chain text format into a {@link GraphContext}.
 *
 * <p>
 * Each line is a chain {@code A -> B -> C}: every name is registered on first
 * mention and linked to the name that follows it. Surrounding whitespace is
 * trimmed; blank lines and empty names are skipped.
 */
public final class EdgeListParser {
    public static final String ARROW = "->";

    private EdgeListParser() {
        // Utility class
    }

    /** Parses into a fresh context. */
    public static GraphContext parse(String text) {
        GraphContext ctx = new GraphContext();
        parseInto(text, ctx);
        return ctx;
    }

    public static void parseInto(String text, GraphContext ctx) {
        for (String rawLine : text.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty())
                continue;
            String prev = null;
            for (String part : line.split(ARROW)) {
                String name = part.trim();
                if (name.isEmpty())
                    continue;
                ctx.addVertex(name);
                if (prev != null)
                    ctx.addEdge(prev, name);
                prev = name;
            }
        }
    }
}
