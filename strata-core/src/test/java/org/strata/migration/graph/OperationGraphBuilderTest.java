package org.strata.migration.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.model.ModelDescriptor;
import org.strata.model.operation.AddField;
import org.strata.model.operation.Operation;
import org.strata.model.operation.RemoveField;
import org.strata.model.operation.RemoveModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.strata.testing.ModelFixtures.column;
import static org.strata.testing.ModelFixtures.create;
import static org.strata.testing.ModelFixtures.foreignKey;
import static org.strata.testing.ModelFixtures.id;
import static org.strata.testing.ModelFixtures.model;

class OperationGraphBuilderTest {

    private final OperationGraphBuilder builder = new OperationGraphBuilder();

    @Test
    @DisplayName("FK 대상 모델을 만드는 연산에서 참조하는 연산으로 간선을 만든다")
    void foreignKey_createsEdgeFromProvider() {
        ModelDescriptor comment = model("blog", "comment", id(), foreignKey("post_id", "blog.Post"));
        ModelDescriptor post = model("blog", "post", id());

        DirectedGraph graph = builder.build(List.of(create(comment), create(post)));

        assertThat(graph.vertexCount()).isEqualTo(2);
        assertThat(graph.edges()).containsExactly(new DirectedGraph.Edge(1, 0));
    }

    @Test
    void externalReference_createsNoEdge() {
        ModelDescriptor order = model("shop", "order", id(), foreignKey("customer_id", "crm.Customer"));

        DirectedGraph graph = builder.build(List.of(create(order)));

        assertThat(graph.edges()).isEmpty();
    }

    @Test
    @DisplayName("자기 참조 FK는 간선을 만들지 않는다")
    void selfReference_createsNoEdge() {
        ModelDescriptor category = model("shop", "category", id(), foreignKey("parent_id", "shop.Category"));

        DirectedGraph graph = builder.build(List.of(create(category)));

        assertThat(graph.edges()).isEmpty();
        assertThat(graph.isAcyclic()).isTrue();
    }

    @Test
    void addField_dependsOnItsTableAndItsTarget() {
        ModelDescriptor customer = model("shop", "customer", id());
        ModelDescriptor address = model("shop", "address", id());
        List<Operation> operations = List.of(
                new AddField("customer", "shop.Customer", foreignKey("address_id", "shop.Address")),
                create(customer),
                create(address));

        DirectedGraph graph = builder.build(operations);

        assertThat(graph.edges()).containsExactly(
                new DirectedGraph.Edge(1, 0),
                new DirectedGraph.Edge(2, 0));
    }

    @Test
    void removals_haveNoEdges() {
        ModelDescriptor customer = model("shop", "customer", id(), column("email"));
        List<Operation> operations = List.of(
                RemoveModel.of(model("shop", "legacy", id(), foreignKey("customer_id", "shop.Customer"))),
                new RemoveField("customer", "shop.Customer", column("email")),
                create(customer));

        assertThat(builder.build(operations).edges()).isEmpty();
    }

    @Test
    void duplicateReferences_collapseToOneEdge() {
        ModelDescriptor post = model("blog", "post", id());
        ModelDescriptor link = model("blog", "link", id(),
                foreignKey("from_id", "blog.Post"), foreignKey("to_id", "blog.Post"));

        DirectedGraph graph = builder.build(List.of(create(post), create(link)));

        assertThat(graph.edges()).containsExactly(new DirectedGraph.Edge(0, 1));
    }
}
