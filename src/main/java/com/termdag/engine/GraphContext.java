package com.termdag.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The graph registry: an arena of {@link Vertex} records plus the layers built
 * over them.
 *
 * Responsibilities:
 * 1. Registration: labelled vertices are added by name, idempotently, and
 * edges link two already-registered names.
 * 2. Index Stability: a vertex's index is its position in the arena. Indices
 * are never reused or reordered, so adjacency can be stored as plain integer
 * sets.
 * 3. Layer Storage: once layering has run, holds the ordered layers the later
 * phases work on.
 *
 * Thread Safety:
 * None. A context belongs to a single layout run; concurrent renders each
 * allocate their own.
 */
public final class GraphContext {
    private final List<Vertex> vertices = new ArrayList<>();
    private final Map<String, Integer> nameToIndex = new HashMap<>();
    final List<Layer> layers = new ArrayList<>();

    /**
     * Registers a labelled vertex. A name that is already known is a no-op.
     *
     * @return the vertex index.
     */
    public int addVertex(String name) {
        Integer existing = nameToIndex.get(name);
        if (existing != null)
            return existing;
        int idx = vertices.size();
        vertices.add(Vertex.labelled(name));
        nameToIndex.put(name, idx);
        return idx;
    }

    /**
     * Adds a directed edge between two registered names. Repeated edges
     * collapse into one.
     *
     * @throws IllegalArgumentException if either name was never registered.
     */
    public void addEdge(String from, String to) {
        link(requireIndex(from), requireIndex(to));
    }

    void link(int a, int b) {
        vertices.get(a).downward.add(b);
        vertices.get(b).upward.add(a);
    }

    void unlink(int a, int b) {
        vertices.get(a).downward.remove(b);
        vertices.get(b).upward.remove(a);
    }

    /**
     * Splices a connector into the edge {@code a -> b}, one layer below
     * {@code a}.
     *
     * @return the connector's index.
     */
    int addConnector(int a, int b) {
        int c = vertices.size();
        vertices.add(Vertex.connector(vertices.get(a).layer + 1));
        unlink(a, b);
        link(a, c);
        link(c, b);
        return c;
    }

    private int requireIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown vertex: " + name);
        return idx;
    }

    /** Resolves a label to its arena index. */
    public int indexOf(String name) {
        return requireIndex(name);
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    public int vertexCount() {
        return vertices.size();
    }

    public Vertex vertex(int idx) {
        return vertices.get(idx);
    }

    /** Shorthand for {@code vertex(indexOf(name))}. */
    public Vertex vertex(String name) {
        return vertices.get(requireIndex(name));
    }

    public List<Layer> layers() {
        return Collections.unmodifiableList(layers);
    }

    public Layer layer(int index) {
        return layers.get(index);
    }
}
