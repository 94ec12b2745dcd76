package com.termdag.engine;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;

/**
 * Chooses the left-to-right order of vertices inside each layer.
 *
 * <p>
 * Layers are processed top-down so a layer always sees its parents' final
 * rows. For a layer of width {@code w > 1} the cost of a permutation is:
 * <ul>
 * <li>for each pair of neighbors in the permutation, how many layers down
 * their descendants first reconverge (a large sentinel if never), and</li>
 * <li>{@code parentWeight} times the squared distance between each vertex's
 * position and the mean row of its parents.</li>
 * </ul>
 * The search starts from index order and applies improving pairwise swaps
 * until a full sweep finds none. This is a local optimum; the result is
 * deterministic for a given input.
 */
@Log4j2
public final class RowOrdering {
    // Keeps the parentless mean finite
    private static final double EPSILON = 0.01;

    private final double parentWeight;

    public RowOrdering(double parentWeight) {
        this.parentWeight = parentWeight;
    }

    public void order(GraphContext ctx) {
        computeClosures(ctx);
        int swaps = 0;
        for (Layer layer : ctx.layers)
            swaps += orderLayer(ctx, layer);
        log.debug("Row ordering settled after {} swaps", swaps);
    }

    /** Fills {@code downwardClosure} bottom-up; the last layer has no children. */
    static void computeClosures(GraphContext ctx) {
        for (int y = ctx.layers.size() - 2; y >= 0; y--) {
            for (int up : ctx.layers.get(y).vertices) {
                Vertex v = ctx.vertex(up);
                Set<Integer> closure = new TreeSet<>();
                for (int d : v.downward) {
                    closure.add(d);
                    closure.addAll(ctx.vertex(d).downwardClosure);
                }
                v.downwardClosure = closure;
            }
        }
    }

    private int orderLayer(GraphContext ctx, Layer layer) {
        final int w = layer.vertices.size();
        if (w <= 1)
            return 0;

        double[] parentMean = new double[w];
        for (int i = 0; i < w; i++) {
            Vertex v = ctx.vertex(layer.vertices.get(i));
            int sum = 0;
            for (int p : v.upward)
                sum += ctx.vertex(p).row;
            parentMean[i] = sum / (v.upward.size() + EPSILON);
        }

        int[][] distance = distances(ctx, layer);

        int[] perm = new int[w];
        for (int i = 0; i < w; i++)
            perm[i] = i;
        double current = score(perm, distance, parentMean);
        int swaps = 0;
        boolean improved = true;
        while (improved) {
            improved = false;
            for (int a = 0; a < w; a++) {
                for (int b = a + 1; b < w; b++) {
                    swap(perm, a, b);
                    double next = score(perm, distance, parentMean);
                    if (next < current) {
                        current = next;
                        improved = true;
                        swaps++;
                    } else {
                        swap(perm, a, b);
                    }
                }
            }
        }

        Integer[] ordered = new Integer[w];
        for (int i = 0; i < w; i++)
            ordered[i] = layer.vertices.get(perm[i]);
        layer.vertices.clear();
        layer.vertices.addAll(Arrays.asList(ordered));
        for (int i = 0; i < w; i++)
            ctx.vertex(layer.vertices.get(i)).row = i;
        return swaps;
    }

    /**
     * Pairwise layer gap to the nearest common descendant.
     */
    static int[][] distances(GraphContext ctx, Layer layer) {
        final int w = layer.vertices.size();
        final int sentinel = ctx.vertexCount() * 2;
        int[][] distance = new int[w][w];
        for (int a = 0; a < w; a++) {
            Vertex va = ctx.vertex(layer.vertices.get(a));
            for (int b = 0; b < w; b++) {
                Vertex vb = ctx.vertex(layer.vertices.get(b));
                int best = sentinel;
                for (int c : va.downwardClosure)
                    if (vb.downwardClosure.contains(c))
                        best = Math.min(best, ctx.vertex(c).layer - va.layer);
                distance[a][b] = best;
            }
        }
        return distance;
    }

    private double score(int[] perm, int[][] distance, double[] parentMean) {
        double s = 0;
        for (int i = 0; i + 1 < perm.length; i++)
            s += distance[perm[i]][perm[i + 1]];
        for (int i = 0; i < perm.length; i++) {
            double d = i - parentMean[perm[i]];
            s += d * d * parentWeight;
        }
        return s;
    }

    private static void swap(int[] perm, int a, int b) {
        int t = perm[a];
        perm[a] = perm[b];
        perm[b] = t;
    }

    /** Checks that each layer's rows are exactly {@code 0..size-1}, in list order. */
    public static boolean rowsArePermutation(GraphContext ctx) {
        for (Layer layer : ctx.layers) {
            boolean[] seen = new boolean[layer.vertices.size()];
            for (int i = 0; i < layer.vertices.size(); i++) {
                int row = ctx.vertex(layer.vertices.get(i)).row;
                if (row != i || seen[row])
                    return false;
                seen[row] = true;
            }
        }
        return true;
    }
}
