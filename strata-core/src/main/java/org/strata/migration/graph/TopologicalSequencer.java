package org.strata.migration.graph;

import org.strata.model.operation.Operation;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders an operation list along its (acyclic) dependency graph.
 */
public class TopologicalSequencer {

    /**
     * @throws IllegalStateException if the graph still has a cycle, which means cycle
     *                               breaking did not run or is broken
     */
    public List<Operation> sequence(List<Operation> operations, DirectedGraph graph) {
        if (graph.vertexCount() != operations.size()) {
            throw new IllegalArgumentException("Graph has " + graph.vertexCount()
                    + " vertices but there are " + operations.size() + " operations");
        }

        List<Integer> order;
        try {
            order = graph.toposort();
        } catch (CycleDetectedException e) {
            throw new IllegalStateException("Cycles must be removed before sequencing operations", e);
        }

        List<Operation> sorted = new ArrayList<>(operations.size());
        for (int index : order) {
            sorted.add(operations.get(index));
        }
        return sorted;
    }
}
