package org.strata.migration;

import org.junit.jupiter.api.Test;
import org.strata.migration.sorter.MigrationSorter;
import org.strata.model.MigrationRecord;
import org.strata.model.ModelDescriptor;
import org.strata.model.dependency.Dependency;
import org.strata.model.operation.AddField;
import org.strata.model.operation.RemoveModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.strata.testing.ModelFixtures.column;
import static org.strata.testing.ModelFixtures.id;
import static org.strata.testing.ModelFixtures.migration;
import static org.strata.testing.ModelFixtures.model;

class MigrationHistoryTest {

    private final ModelDescriptor customer = model("shop", "customer", id());
    private final ModelDescriptor customerWithEmail = model("shop", "customer", id(), column("email"));
    private final ModelDescriptor order = model("shop", "order", id());

    private final MigrationRecord initial = migration("shop", "m_0001_initial", List.of(), customer, order);
    private final MigrationRecord addEmail = MigrationRecord.builder()
            .groupIdentifier("shop")
            .migrationIdentifier("m_0002_auto_20240101_000000")
            .dependency(Dependency.onMigration("shop", "m_0001_initial"))
            .operation(new AddField("customer", "shop.Customer", column("email")))
            .model(customerWithEmail)
            .build();
    private final MigrationRecord dropOrder = MigrationRecord.builder()
            .groupIdentifier("shop")
            .migrationIdentifier("m_0003_auto_20240102_000000")
            .dependency(Dependency.onMigration("shop", "m_0002_auto_20240101_000000"))
            .operation(RemoveModel.of(order))
            .build();
    private final MigrationRecord crm = migration("crm", "m_0001_initial", List.of(), model("crm", "lead", id()));

    @Test
    void migrationsAreOrdered() {
        MigrationHistory history = MigrationHistory.of(List.of(dropOrder, crm, addEmail, initial), new MigrationSorter());

        assertThat(history.getMigrations()).containsExactly(crm, initial, addEmail, dropOrder);
        assertThat(history.getMigrations("shop")).containsExactly(initial, addEmail, dropOrder);
        assertThat(history.getGroups()).containsExactly("crm", "shop");
    }

    @Test
    void lastMigration() {
        MigrationHistory history = MigrationHistory.of(List.of(addEmail, initial), new MigrationSorter());

        assertThat(history.lastMigration("shop")).contains(addEmail);
        assertThat(history.lastMigration("crm")).isEmpty();
    }

    @Test
    void latestModels_replaysEveryMigrationOfTheGroup() {
        MigrationHistory history = MigrationHistory.of(List.of(initial, addEmail, crm), new MigrationSorter());

        assertThat(history.latestModels("shop")).containsExactly(customerWithEmail, order);
        assertThat(history.latestModels("crm")).extracting(ModelDescriptor::getTableName).containsExactly("lead");
    }

    @Test
    void latestModels_forgetsRemovedModels() {
        MigrationHistory history = MigrationHistory.of(List.of(initial, addEmail, dropOrder), new MigrationSorter());

        assertThat(history.latestModels("shop")).containsExactly(customerWithEmail);
    }

    @Test
    void emptyHistory() {
        MigrationHistory history = MigrationHistory.of(List.of(), new MigrationSorter());

        assertThat(history.getMigrations()).isEmpty();
        assertThat(history.latestModels("shop")).isEmpty();
        assertThat(history.lastMigration("shop")).isEmpty();
    }
}
