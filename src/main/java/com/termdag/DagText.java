package com.termdag;

import com.termdag.api.CycleFoundException;
import com.termdag.api.LayoutListener;
import com.termdag.api.LayoutPhase;
import com.termdag.engine.GraphContext;
import com.termdag.engine.LayoutConfig;
import com.termdag.engine.LayoutEngine;
import com.termdag.io.EdgeListParser;
import com.termdag.io.GraphDefinition;
import com.termdag.io.GraphDefinitionLoader;

import java.util.Collection;
import java.util.function.Function;

/**
 * term-dag: renders a directed acyclic graph as a box-drawing text diagram.
 *
 * <h2>Input</h2>
 * <p>
 * Lines of arrow chains:
 *
 * <pre>
 * A -> B -> C
 * D -> C
 * D -> E
 * </pre>
 *
 * <h2>Output</h2>
 *
 * <pre>
 * ┌───┐┌───┐
 * │ A ││ D │
 * └┬──┘└┬─┬┘
 * ┌▽──┐ │┌▽──┐
 * │ B │ ││ E │
 * └┬──┘ │└───┘
 * ┌▽────▽─┐
 * │   C   │
 * └───────┘
 * </pre>
 *
 * <p>
 * Rendering is deterministic: the same input always yields the same text. A
 * graph with a cycle raises {@link CycleFoundException}. Every call builds its
 * own {@link GraphContext}, so a {@code DagText} can be shared between threads
 * as long as no listener is attached.
 */
public final class DagText {
    private final LayoutEngine engine;
    private LayoutListener listener;

    private DagText(LayoutConfig config) {
        this.engine = new LayoutEngine(config);
    }

    /** Renders arrow-chain text with the default configuration. */
    public static String render(String text) {
        return create().renderText(text);
    }

    public static DagText create() {
        return new DagText(LayoutConfig.defaults());
    }

    public static DagText create(LayoutConfig config) {
        return new DagText(config);
    }

    public DagText withListener(LayoutListener listener) {
        this.listener = listener;
        engine.setListener(listener);
        return this;
    }

    /**
     * Renders arrow-chain text. Empty or blank input renders as the empty
     * string.
     *
     * @throws CycleFoundException if the edges form a directed cycle.
     */
    public String renderText(String text) {
        long start = 0;
        if (listener != null) {
            listener.onPhaseStart(LayoutPhase.PARSE);
            start = System.nanoTime();
        }
        GraphContext ctx = EdgeListParser.parse(text);
        if (listener != null)
            listener.onPhaseEnd(LayoutPhase.PARSE, System.nanoTime() - start);
        return engine.render(ctx);
    }

    /**
     * Renders a caller-owned graph structure.
     *
     * @param nodes      every node of the graph.
     * @param successors the direct children of a node; {@code null} means none.
     * @param label      the text drawn for a node; nodes with equal labels are
     *                   drawn as one box.
     * @throws CycleFoundException if the graph has a directed cycle.
     */
    public <N> String renderGraph(Collection<N> nodes, Function<N, ? extends Iterable<N>> successors,
            Function<N, String> label) {
        GraphContext ctx = new GraphContext();
        for (N node : nodes) {
            String source = label.apply(node);
            ctx.addVertex(source);
            Iterable<? extends N> children = successors.apply(node);
            if (children == null)
                continue;
            for (N child : children) {
                String target = label.apply(child);
                ctx.addVertex(target);
                ctx.addEdge(source, target);
            }
        }
        return engine.render(ctx);
    }

    /**
     * Renders a JSON graph definition. A style named by the definition
     * overrides this instance's glyph style.
     */
    public String renderDefinition(GraphDefinition def) {
        GraphContext ctx = GraphDefinitionLoader.toContext(def);
        var style = GraphDefinitionLoader.styleOf(def, engine.config().getGlyphStyle());
        if (style == engine.config().getGlyphStyle())
            return engine.render(ctx);
        LayoutEngine styled = new LayoutEngine(engine.config().withGlyphStyle(style));
        styled.setListener(listener);
        return styled.render(ctx);
    }
}
