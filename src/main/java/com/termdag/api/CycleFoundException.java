package com.termdag.api;

/**
 * Raised when the input graph contains a directed cycle.
 *
 * <p>
 * Detected during layering: the leveling fixpoint never stabilizes when a
 * cycle is present, so once the pass count exceeds the square of the vertex
 * count the layout is abandoned. No partial diagram is produced.
 */
public final class CycleFoundException extends RuntimeException {
    private final int vertexCount;
    private final int passes;

    public CycleFoundException(int vertexCount, int passes) {
        super("The graph has a cycle (no stable layering after " + passes + " passes over "
                + vertexCount + " vertices)");
        this.vertexCount = vertexCount;
        this.passes = passes;
    }

    public int vertexCount() {
        return vertexCount;
    }

    public int passes() {
        return passes;
    }
}
