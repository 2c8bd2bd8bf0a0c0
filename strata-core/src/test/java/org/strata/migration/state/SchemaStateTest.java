package org.strata.migration.state;

import org.junit.jupiter.api.Test;
import org.strata.model.ModelDescriptor;
import org.strata.model.operation.AddField;
import org.strata.model.operation.CreateModel;
import org.strata.model.operation.Operation;
import org.strata.model.operation.RemoveField;
import org.strata.model.operation.RemoveModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.testing.ModelFixtures.column;
import static org.strata.testing.ModelFixtures.id;
import static org.strata.testing.ModelFixtures.model;

class SchemaStateTest {

    private final ModelDescriptor customer = model("shop", "customer", id(), column("email"));

    @Test
    void applyAndRevert_everyOperationKind() {
        List<Operation> operations = List.of(
                CreateModel.of(model("shop", "order", id())),
                new AddField("customer", "shop.Customer", column("name")),
                new RemoveField("customer", "shop.Customer", column("email")),
                RemoveModel.of(model("shop", "customer", id(), column("name"))));
        SchemaState state = SchemaState.of(List.of(customer));

        state.applyAll(operations);

        assertThat(state.tableNames()).containsExactly("order");
        assertThat(state.columns("order")).containsOnlyKeys("id");

        state.revertAll(operations);

        assertThat(state).isEqualTo(SchemaState.of(List.of(customer)));
        assertThat(state.columns("customer")).containsOnlyKeys("id", "email");
    }

    @Test
    void columnOrder_isNotPartOfEquality() {
        SchemaState a = SchemaState.of(List.of(model("shop", "customer", id(), column("email"))));
        SchemaState b = SchemaState.of(List.of(model("shop", "customer", column("email"), id())));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void invalidTransitions_areRejected() {
        SchemaState state = SchemaState.of(List.of(customer));

        assertThatThrownBy(() -> state.apply(CreateModel.of(customer)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> state.apply(new AddField("customer", "shop.Customer", column("email"))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> state.apply(new RemoveField("customer", "shop.Customer", column("phone"))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> state.apply(new AddField("order", "shop.Order", column("note"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not exist");
        assertThatThrownBy(() -> state.revert(CreateModel.of(model("shop", "order", id()))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyState() {
        assertThat(SchemaState.empty().tableNames()).isEmpty();
        assertThat(SchemaState.empty().hasTable("customer")).isFalse();
        assertThat(SchemaState.empty()).isEqualTo(SchemaState.of(List.of()));
    }
}
