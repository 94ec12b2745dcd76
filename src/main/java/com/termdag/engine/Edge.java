package com.termdag.engine;

/**
 * A direct edge between two vertices on adjacent layers, plus the column it
 * is drawn at.
 */
public final class Edge {
    final int up;
    final int down;
    int x;
    int y;

    Edge(int up, int down) {
        this.up = up;
        this.down = down;
    }

    public int up() {
        return up;
    }

    public int down() {
        return down;
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    boolean sameEndpoints(Edge other) {
        return up == other.up && down == other.down;
    }

    @Override
    public String toString() {
        return up + "->" + down + "@" + x;
    }
}
