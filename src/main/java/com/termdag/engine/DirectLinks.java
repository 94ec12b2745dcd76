package com.termdag.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Direct edges, ordered by parent row then child row.
 */
public final class DirectLinks implements LayerLinks {
    final List<Edge> edges = new ArrayList<>();

    public List<Edge> edges() {
        return edges;
    }
}
