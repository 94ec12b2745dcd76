package com.termdag.engine;

import com.termdag.api.LayoutListener;
import com.termdag.bus.Bus;
import com.termdag.bus.BusRouter;
import com.termdag.screen.Screen;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Computes vertex sizes and positions, edge columns and bus rasters.
 *
 * <h3>Relaxation</h3>
 * Starting from every coordinate at 0, an ordered list of corrections is
 * applied until a full round changes nothing:
 * <ol>
 * <li>vertices in a layer do not overlap;</li>
 * <li>edges in a layer do not share a column;</li>
 * <li>a labelled vertex grows to cover every edge column it touches;</li>
 * <li>an edge sits at or right of both endpoints' padded left edge;</li>
 * <li>a connector sits at or right of every edge touching it.</li>
 * </ol>
 * Each correction only ever moves things right or makes them wider, and a
 * round restarts as soon as one correction reports a change. The first two
 * sweep every layer; the last three stop at their first fix. The round count
 * is capped so the solver terminates even on inputs that keep pushing.
 *
 * <h3>Buses</h3>
 * Once positions are fixed, every bus-routed layer gets a {@link Bus} spanning
 * both neighboring layers, with one connection id per (parent, child) pair,
 * and is routed by {@link BusRouter}. Finally rows are assigned top-down;
 * a bus adds {@code height - 3} rows below its layer.
 */
@Log4j2
public final class GeometrySolver {
    public static final int VERTEX_HEIGHT = 3;

    /** One idempotent correction. */
    @FunctionalInterface
    interface RelaxationPass {
        /** @return true if anything moved or grew. */
        boolean relax();
    }

    private final GraphContext ctx;
    private final LayoutConfig config;
    private final LayoutListener listener;
    private final List<RelaxationPass> passes;

    public GeometrySolver(GraphContext ctx, LayoutConfig config, LayoutListener listener) {
        this.ctx = ctx;
        this.config = config;
        this.listener = listener;
        this.passes = List.of(
                this::separateVertices,
                this::separateEdges,
                this::growVertices,
                this::shiftEdges,
                this::shiftConnectors);
    }

    public void solve() {
        initialSizes();
        relax();
        buildBuses();
        assignRows();
    }

    void initialSizes() {
        for (int i = 0; i < ctx.vertexCount(); i++) {
            Vertex v = ctx.vertex(i);
            if (v.connector) {
                v.width = 1;
            } else {
                int chars = Screen.displayWidth(v.label);
                int width = Math.max(chars, Math.max(v.upward.size(), v.downward.size()));
                // At least 2 columns of margin around the label
                while (width - chars < 2)
                    width++;
                // Same parity as the label so it centers exactly
                if (width % 2 != chars % 2)
                    width++;
                v.width = width + 2;
            }
            v.height = VERTEX_HEIGHT;
        }
    }

    /**
     * @return the number of rounds run; equal to the ceiling if the layout did
     *         not settle.
     */
    int relax() {
        final int ceiling = config.getRelaxationCeiling();
        for (int round = 0; round < ceiling; round++) {
            boolean changed = false;
            for (RelaxationPass pass : passes) {
                if (pass.relax()) {
                    changed = true;
                    break;
                }
            }
            if (!changed) {
                log.debug("Geometry settled after {} rounds", round);
                return round;
            }
        }
        log.warn("Geometry did not settle within {} rounds; using the last state", ceiling);
        return ceiling;
    }

    boolean separateVertices() {
        boolean changed = false;
        for (Layer layer : ctx.layers) {
            int x = 0;
            for (int n : layer.vertices) {
                Vertex v = ctx.vertex(n);
                if (v.x < x) {
                    v.x = x;
                    changed = true;
                }
                x = v.x + v.width;
            }
        }
        return changed;
    }

    boolean separateEdges() {
        boolean changed = false;
        for (Layer layer : ctx.layers) {
            int x = 0;
            for (Edge e : layer.edges()) {
                if (e.x < x) {
                    e.x = x;
                    changed = true;
                }
                x = e.x + 1;
            }
        }
        return changed;
    }

    boolean growVertices() {
        for (Layer layer : ctx.layers) {
            for (Edge e : layer.edges()) {
                if (growToCover(ctx.vertex(e.up), e.x) || growToCover(ctx.vertex(e.down), e.x))
                    return true;
            }
        }
        return false;
    }

    private static boolean growToCover(Vertex v, int column) {
        // Last usable column is just inside the right border
        if (v.connector || v.x + v.width - 2 >= column)
            return false;
        int parity = v.width % 2;
        v.width = column + 2 - v.x;
        if (v.width % 2 != parity)
            v.width++;
        return true;
    }

    boolean shiftEdges() {
        for (Layer layer : ctx.layers) {
            for (Edge e : layer.edges()) {
                int min = Math.max(ctx.vertex(e.up).innerLeft(), ctx.vertex(e.down).innerLeft());
                if (e.x < min) {
                    e.x = min;
                    return true;
                }
            }
        }
        return false;
    }

    boolean shiftConnectors() {
        for (int i = 0; i < ctx.vertexCount(); i++) {
            Vertex v = ctx.vertex(i);
            if (!v.connector)
                continue;
            int min = 0;
            for (Edge e : ctx.layers.get(v.layer - 1).edges())
                if (e.down == i)
                    min = Math.max(min, e.x);
            for (Edge e : ctx.layers.get(v.layer).edges())
                if (e.up == i)
                    min = Math.max(min, e.x);
            if (v.x < min) {
                v.x = min;
                return true;
            }
        }
        return false;
    }

    void buildBuses() {
        BusRouter router = new BusRouter(config.getBusMinHeight(), config.getBusMaxHeight());
        for (int y = 0; y + 1 < ctx.layers.size(); y++) {
            Layer up = ctx.layers.get(y);
            if (!(up.links instanceof BusLinks links))
                continue;
            Layer down = ctx.layers.get(y + 1);

            int width = 0;
            for (int n : up.vertices)
                width = Math.max(width, ctx.vertex(n).x + ctx.vertex(n).width);
            for (int n : down.vertices)
                width = Math.max(width, ctx.vertex(n).x + ctx.vertex(n).width);

            Bus bus = new Bus(width);
            Map<Long, Integer> ids = new HashMap<>();
            for (int a : up.vertices) {
                Vertex v = ctx.vertex(a);
                for (int x = v.innerLeft(); x < v.innerRight(); x++)
                    for (int b : v.downward)
                        bus.addInput(x, connectionId(ids, a, b));
            }
            for (int b : down.vertices) {
                Vertex v = ctx.vertex(b);
                for (int x = v.innerLeft(); x < v.innerRight(); x++)
                    for (int a : v.upward)
                        bus.addOutput(x, connectionId(ids, a, b));
            }

            int height = router.route(bus);
            links.bus = bus;
            log.debug("Bus below layer {}: {} connections, width {}, height {}", y, ids.size(), width, height);
            if (listener != null)
                listener.onBusSolved(y, height, bus.isForced());
        }
    }

    private static int connectionId(Map<Long, Integer> ids, int a, int b) {
        long key = ((long) a << 32) | b;
        Integer id = ids.get(key);
        if (id == null) {
            id = ids.size() + 1;
            ids.put(key, id);
        }
        return id;
    }

    void assignRows() {
        int y = 0;
        for (Layer layer : ctx.layers) {
            for (int n : layer.vertices)
                ctx.vertex(n).y = y;
            for (Edge e : layer.edges())
                e.y = y + 2;
            Bus bus = layer.bus();
            if (bus != null) {
                bus.setY(y + 2);
                y += bus.height() - VERTEX_HEIGHT;
            }
            y += VERTEX_HEIGHT;
        }
    }

    /**
     * Checks the solved geometry: no two boxes in a layer overlap, and every
     * direct edge lies inside both endpoints' padded interior.
     */
    public static boolean isConsistent(GraphContext ctx) {
        for (Layer layer : ctx.layers) {
            int right = 0;
            for (int n : layer.vertices) {
                Vertex v = ctx.vertex(n);
                if (v.x < right)
                    return false;
                right = v.x + v.width;
            }
            for (Edge e : layer.edges()) {
                for (Vertex v : new Vertex[] { ctx.vertex(e.up), ctx.vertex(e.down) }) {
                    if (e.x < v.innerLeft() || e.x >= v.innerRight())
                        return false;
                }
            }
        }
        return true;
    }
}
