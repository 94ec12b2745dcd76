package com.termdag.engine;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One vertex of the arena held by {@link GraphContext}.
 *
 * <p>
 * Neighbors are referenced by arena index, never by object, so vertices can
 * point at each other before the graph is known to be acyclic. Adjacency sets
 * are ordered by index to keep every traversal deterministic.
 *
 * <p>
 * Fields are filled in phase by phase: adjacency during registration and
 * layering, {@code layer}/{@code row} and the sorted adjacency during
 * ordering, geometry during solving. Rasterization only reads them.
 */
public final class Vertex {
    static final int[] NO_NEIGHBORS = new int[0];

    final String label;
    final boolean connector;
    final int padding;
    final TreeSet<Integer> upward = new TreeSet<>();
    final TreeSet<Integer> downward = new TreeSet<>();

    int layer;
    int row;
    Set<Integer> downwardClosure = Collections.emptySet();
    int[] upwardSorted = NO_NEIGHBORS;
    int[] downwardSorted = NO_NEIGHBORS;

    int width;
    int height;
    int x;
    int y;

    private Vertex(String label, boolean connector, int padding) {
        this.label = label;
        this.connector = connector;
        this.padding = padding;
    }

    static Vertex labelled(String label) {
        return new Vertex(label, false, 1);
    }

    static Vertex connector(int layer) {
        Vertex v = new Vertex("", true, 0);
        v.layer = layer;
        return v;
    }

    public String label() {
        return label;
    }

    public boolean isConnector() {
        return connector;
    }

    public int padding() {
        return padding;
    }

    public Set<Integer> upward() {
        return Collections.unmodifiableSet(upward);
    }

    public Set<Integer> downward() {
        return Collections.unmodifiableSet(downward);
    }

    public Set<Integer> downwardClosure() {
        return Collections.unmodifiableSet(downwardClosure);
    }

    public int layer() {
        return layer;
    }

    public int row() {
        return row;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    /** First column inside the border (and padding) that an edge may use. */
    public int innerLeft() {
        return x + padding;
    }

    /** One past the last column an edge may use. */
    public int innerRight() {
        return x + width - padding;
    }

    @Override
    public String toString() {
        return connector ? "connector@" + layer + ":" + row : label + "@" + layer + ":" + row;
    }
}
