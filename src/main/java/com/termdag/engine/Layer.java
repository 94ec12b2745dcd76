package com.termdag.engine;

import com.termdag.bus.Bus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vertices of one rank, in row order, plus the links to the next rank.
 */
public final class Layer {
    final int index;
    final List<Integer> vertices = new ArrayList<>();
    LayerLinks links = new DirectLinks();

    Layer(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }

    /** Vertex indices in row order. */
    public List<Integer> vertices() {
        return Collections.unmodifiableList(vertices);
    }

    public int size() {
        return vertices.size();
    }

    public LayerLinks links() {
        return links;
    }

    public boolean isBusEnabled() {
        return links instanceof BusLinks;
    }

    /** The direct edges, or an empty list for a bus-routed layer. */
    public List<Edge> edges() {
        if (links instanceof DirectLinks direct)
            return direct.edges;
        return Collections.emptyList();
    }

    /** The solved bus, or null if the layer is drawn with direct edges. */
    public Bus bus() {
        if (links instanceof BusLinks busLinks)
            return busLinks.bus;
        return null;
    }
}
