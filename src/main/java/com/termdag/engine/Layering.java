package com.termdag.engine;

import com.termdag.api.CycleFoundException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Assigns every vertex to a layer and makes every edge span exactly one
 * layer.
 *
 * <h3>Leveling</h3>
 * A relaxation fixpoint: any edge {@code a -> b} with
 * {@code layer(b) <= layer(a)} raises {@code b} to {@code layer(a) + 1}.
 * Layers only grow, and in an acyclic graph they are bounded by the vertex
 * count, so a run that has not settled after {@code n*n} passes proves a
 * cycle.
 *
 * <h3>Completion</h3>
 * Every edge spanning more than one layer gets a connector spliced in right
 * below its upper end. Each splice shortens that edge's span by one, so the
 * sweep terminates.
 */
@Log4j2
public final class Layering {

    private Layering() {
    }

    /**
     * Runs the leveling fixpoint.
     *
     * @return the number of passes it took.
     * @throws CycleFoundException if the layering never stabilizes.
     */
    public static int assignLayers(GraphContext ctx) {
        final int n = ctx.vertexCount();
        final long bound = (long) n * n;
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int a = 0; a < n; a++) {
                Vertex va = ctx.vertex(a);
                for (int b : va.downward) {
                    Vertex vb = ctx.vertex(b);
                    if (vb.layer <= va.layer) {
                        vb.layer = va.layer + 1;
                        changed = true;
                    }
                }
            }
            passes++;
            if (passes > bound)
                throw new CycleFoundException(n, passes);
        }
        log.debug("Leveled {} vertices in {} passes", n, passes);
        return passes;
    }

    /**
     * Splices connectors into every edge spanning more than one layer.
     *
     * @return the number of connectors inserted.
     */
    public static int complete(GraphContext ctx) {
        int inserted = 0;
        boolean again = true;
        while (again) {
            again = false;
            // Connectors added during a sweep are checked on the next one
            final int n = ctx.vertexCount();
            for (int a = 0; a < n; a++) {
                Vertex va = ctx.vertex(a);
                for (int b : new ArrayList<>(va.downward)) {
                    if (ctx.vertex(b).layer != va.layer + 1) {
                        ctx.addConnector(a, b);
                        inserted++;
                        again = true;
                        break;
                    }
                }
            }
        }
        log.debug("Inserted {} connectors", inserted);
        return inserted;
    }

    /**
     * Groups vertices by layer, in index order. Rows are assigned later by
     * {@link RowOrdering}.
     */
    public static void buildLayers(GraphContext ctx) {
        int last = 0;
        for (int i = 0; i < ctx.vertexCount(); i++)
            last = Math.max(last, ctx.vertex(i).layer);

        ctx.layers.clear();
        for (int y = 0; y <= last; y++)
            ctx.layers.add(new Layer(y));
        for (int i = 0; i < ctx.vertexCount(); i++)
            ctx.layers.get(ctx.vertex(i).layer).vertices.add(i);
    }

    /**
     * Sorts every vertex's adjacency by neighbor row and regenerates each
     * layer's direct-edge list from it.
     */
    public static void buildEdges(GraphContext ctx) {
        Comparator<Integer> byRow = Comparator.comparingInt(i -> ctx.vertex(i).row);
        for (int i = 0; i < ctx.vertexCount(); i++) {
            Vertex v = ctx.vertex(i);
            v.upwardSorted = sortedBy(v.upward, byRow);
            v.downwardSorted = sortedBy(v.downward, byRow);
        }
        for (Layer layer : ctx.layers) {
            DirectLinks links = new DirectLinks();
            for (int up : layer.vertices)
                for (int down : ctx.vertex(up).downwardSorted)
                    links.edges.add(new Edge(up, down));
            layer.links = links;
        }
    }

    private static int[] sortedBy(Set<Integer> neighbors, Comparator<Integer> order) {
        if (neighbors.isEmpty())
            return Vertex.NO_NEIGHBORS;
        Integer[] sorted = neighbors.toArray(new Integer[0]);
        Arrays.sort(sorted, order);
        int[] out = new int[sorted.length];
        for (int i = 0; i < sorted.length; i++)
            out[i] = sorted[i];
        return out;
    }

    /** Checks that every retained edge spans exactly one layer. */
    public static boolean isProper(GraphContext ctx) {
        for (int a = 0; a < ctx.vertexCount(); a++) {
            Vertex va = ctx.vertex(a);
            for (int b : va.downward)
                if (ctx.vertex(b).layer != va.layer + 1)
                    return false;
        }
        return true;
    }

    /** Vertex labels per layer, in row order; connectors appear as {@code "|"}. */
    public static List<List<String>> describe(GraphContext ctx) {
        List<List<String>> out = new ArrayList<>();
        for (Layer layer : ctx.layers) {
            List<String> row = new ArrayList<>();
            for (int v : layer.vertices)
                row.add(ctx.vertex(v).connector ? "|" : ctx.vertex(v).label);
            out.add(row);
        }
        return out;
    }
}
