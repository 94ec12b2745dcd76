package com.termdag.engine;

import com.termdag.api.CycleFoundException;
import com.termdag.api.LayoutListener;
import com.termdag.api.LayoutPhase;
import com.termdag.bus.Bus;
import com.termdag.screen.Screen;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives a registered graph through the layout pipeline and rasterizes it.
 *
 * Pipeline (each phase runs exactly once and relies on the previous one):
 *
 * 1. Layering: level vertices, fail on cycles.
 * 2. Completion: splice connectors so every edge spans one layer.
 * 3. Ordering: choose rows, then sort adjacency and build direct edges.
 * 4. Crossings: move layers with unavoidable crossings to bus routing.
 * 5. Geometry: sizes, positions, bus routing, rows.
 * 6. Raster: boxes, labels, edge glyphs, bus overlays, glyph style.
 *
 * The engine holds no per-graph state, so one instance may render many
 * graphs, but a GraphContext must not be shared between concurrent renders.
 */
public final class LayoutEngine {
    private static final Logger log = LogManager.getLogger(LayoutEngine.class);

    private final LayoutConfig config;
    private LayoutListener listener;

    public LayoutEngine() {
        this(LayoutConfig.defaults());
    }

    public LayoutEngine(LayoutConfig config) {
        this.config = config;
    }

    public void setListener(LayoutListener listener) {
        this.listener = listener;
    }

    public LayoutConfig config() {
        return config;
    }

    /**
     * Lays out and renders a registered graph. An empty graph renders as the
     * empty string.
     *
     * @throws CycleFoundException if the graph has a directed cycle.
     */
    public String render(GraphContext ctx) {
        if (ctx.isEmpty())
            return "";
        layout(ctx);
        long start = phaseStart(LayoutPhase.RASTER);
        String out = rasterize(ctx).stringify();
        phaseEnd(LayoutPhase.RASTER, start);
        return out;
    }

    /**
     * Runs every phase except rasterization, leaving the solved layout in the
     * context.
     *
     * @throws CycleFoundException if the graph has a directed cycle.
     */
    public void layout(GraphContext ctx) {
        long start = phaseStart(LayoutPhase.LAYERING);
        Layering.assignLayers(ctx);
        phaseEnd(LayoutPhase.LAYERING, start);

        start = phaseStart(LayoutPhase.COMPLETION);
        Layering.complete(ctx);
        Layering.buildLayers(ctx);
        phaseEnd(LayoutPhase.COMPLETION, start);

        start = phaseStart(LayoutPhase.ORDERING);
        new RowOrdering(config.getParentWeight()).order(ctx);
        Layering.buildEdges(ctx);
        phaseEnd(LayoutPhase.ORDERING, start);
        if (log.isDebugEnabled())
            log.debug("Layers: {}", Layering.describe(ctx));

        start = phaseStart(LayoutPhase.CROSSINGS);
        CrossingResolver.resolve(ctx);
        phaseEnd(LayoutPhase.CROSSINGS, start);

        start = phaseStart(LayoutPhase.GEOMETRY);
        new GeometrySolver(ctx, config, listener).solve();
        phaseEnd(LayoutPhase.GEOMETRY, start);
    }

    /** Draws a solved layout. */
    public Screen rasterize(GraphContext ctx) {
        int w = 0, h = 0;
        for (int i = 0; i < ctx.vertexCount(); i++) {
            Vertex v = ctx.vertex(i);
            w = Math.max(w, v.x + v.width);
            h = Math.max(h, v.y + v.height);
        }
        for (Layer layer : ctx.layers)
            for (Edge e : layer.edges())
                w = Math.max(w, e.x + 1);

        Screen screen = new Screen(w, h);

        for (int i = 0; i < ctx.vertexCount(); i++) {
            Vertex v = ctx.vertex(i);
            if (v.connector) {
                screen.drawVerticalLine(v.y, v.y + v.height - 1, v.x, '│');
            } else {
                screen.drawBox(v.x, v.y, v.width, v.height);
                screen.drawTextInBoxCenter(v.x, v.y, v.width, v.label);
            }
        }

        for (Layer layer : ctx.layers) {
            for (Edge e : layer.edges()) {
                screen.drawPixel(e.x, e.y, ctx.vertex(e.up).connector ? '│' : '┬');
                screen.drawPixel(e.x, e.y + 1, ctx.vertex(e.down).connector ? '│' : '▽');
            }
        }

        for (Layer layer : ctx.layers) {
            Bus bus = layer.bus();
            if (bus != null)
                bus.render(screen);
        }

        screen.asciify(config.getGlyphStyle());
        return screen;
    }

    private long phaseStart(LayoutPhase phase) {
        if (listener == null)
            return 0;
        listener.onPhaseStart(phase);
        return System.nanoTime();
    }

    private void phaseEnd(LayoutPhase phase, long start) {
        if (listener != null)
            listener.onPhaseEnd(phase, System.nanoTime() - start);
    }
}
