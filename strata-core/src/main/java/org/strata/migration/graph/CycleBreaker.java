package org.strata.migration.graph;

import lombok.extern.slf4j.Slf4j;
import org.strata.model.FieldDescriptor;
import org.strata.model.operation.AddField;
import org.strata.model.operation.CreateModel;
import org.strata.model.operation.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes foreign key cycles between newly created models.
 * <p>
 * For every edge of the feedback arc set the dependent {@link CreateModel} loses the foreign
 * keys that point at the provider's type, and each of those fields is appended as an
 * {@link AddField}. The appended operations only run once both tables exist, so the rebuilt
 * graph is acyclic. The returned list keeps every original operation at its index.
 */
@Slf4j
public class CycleBreaker {
    private final OperationGraphBuilder graphBuilder;
    private final GreedyFeedbackArcSet feedbackArcSet;

    public CycleBreaker() {
        this(new OperationGraphBuilder(), new GreedyFeedbackArcSet());
    }

    public CycleBreaker(OperationGraphBuilder graphBuilder, GreedyFeedbackArcSet feedbackArcSet) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder must not be null");
        this.feedbackArcSet = Objects.requireNonNull(feedbackArcSet, "feedbackArcSet must not be null");
    }

    public List<Operation> breakCycles(List<Operation> operations) {
        DirectedGraph graph = graphBuilder.build(operations);
        List<DirectedGraph.Edge> arcs = feedbackArcSet.find(graph);
        if (arcs.isEmpty()) {
            return List.copyOf(operations);
        }

        List<Operation> result = new ArrayList<>(operations);
        for (DirectedGraph.Edge arc : arcs) {
            // 이전 단계에서 이미 줄어든 CreateModel을 기준으로 작업
            CreateModel provider = requireCreateModel(result.get(arc.from()), arc);
            CreateModel dependent = requireCreateModel(result.get(arc.to()), arc);
            log.debug("Removing cycle edge {}: '{}' no longer creates its foreign keys to '{}'",
                    arc, dependent.tableName(), provider.tableName());

            List<FieldDescriptor> moved = dependent.foreignKeysTo(provider.typeIdentifier());
            result.set(arc.to(), dependent.withoutForeignKeysTo(provider.typeIdentifier()));
            for (FieldDescriptor field : moved) {
                result.add(new AddField(dependent.tableName(), dependent.typeIdentifier(), field));
            }
        }
        return result;
    }

    private static CreateModel requireCreateModel(Operation operation, DirectedGraph.Edge arc) {
        if (operation instanceof CreateModel create) {
            return create;
        }
        // 순환에 참여할 수 있는 것은 CreateModel 뿐
        throw new IllegalStateException("Cycle edge " + arc + " touches " + operation.type()
                + " on '" + operation.tableName() + "'; only CreateModel operations can form cycles");
    }
}
