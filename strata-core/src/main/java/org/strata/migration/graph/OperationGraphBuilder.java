package org.strata.migration.graph;

import org.strata.model.operation.Operation;

import java.util.List;
import java.util.Map;

/**
 * Builds the "must run before" graph of an operation list: an edge {@code p -> q} means that
 * operation {@code q} needs the model created by operation {@code p}. References to models
 * not created in the list are external and produce no edge.
 */
public class OperationGraphBuilder {

    public DirectedGraph build(List<Operation> operations) {
        Map<String, Integer> providers = OperationReferences.providers(operations);
        DirectedGraph graph = new DirectedGraph(operations.size());

        for (OperationReferences.Reference ref : OperationReferences.collect(operations)) {
            Integer provider = providers.get(ref.targetType());
            // 자기 참조 FK는 CREATE TABLE 안에서 해결되므로 간선 없음
            if (provider != null && provider != ref.operationIndex()) {
                graph.addEdge(provider, ref.operationIndex());
            }
        }
        return graph;
    }
}
