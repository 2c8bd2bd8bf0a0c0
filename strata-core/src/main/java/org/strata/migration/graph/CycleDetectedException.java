package org.strata.migration.graph;

/**
 * Thrown by {@link DirectedGraph#toposort()} when the graph has no topological order.
 */
public class CycleDetectedException extends Exception {
    private final int vertex;

    public CycleDetectedException(int vertex) {
        super("Cycle detected in the graph at vertex " + vertex);
        this.vertex = vertex;
    }

    /**
     * A vertex that lies on the detected cycle.
     */
    public int getVertex() {
        return vertex;
    }
}
