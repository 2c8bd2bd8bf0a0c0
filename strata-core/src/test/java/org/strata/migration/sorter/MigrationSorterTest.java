package org.strata.migration.sorter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.model.Migration;
import org.strata.model.MigrationRecord;
import org.strata.model.dependency.Dependency;
import org.strata.model.operation.CreateModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MigrationSorterTest {

    private final MigrationSorter sorter = new MigrationSorter();

    private static MigrationRecord migration(String group, String id, Dependency... dependencies) {
        return MigrationRecord.builder()
                .groupIdentifier(group)
                .migrationIdentifier(id)
                .dependencies(List.of(dependencies))
                .build();
    }

    private static MigrationRecord creating(String group, String id, String table, Dependency... dependencies) {
        return migration(group, id, dependencies).toBuilder()
                .operation(new CreateModel(table, group + "." + table, List.of()))
                .build();
    }

    @Test
    @DisplayName("의존성이 없으면 (그룹, 이름) 순으로 정렬한다")
    void sort_withoutDependencies_ordersByGroupAndIdentifier() {
        List<MigrationRecord> sorted = sorter.sort(List.of(
                migration("app2", "migration1"),
                migration("app1", "migration2"),
                migration("app1", "migration1")));

        assertThat(sorted).extracting(Migration::getGroupIdentifier, Migration::getMigrationIdentifier)
                .containsExactly(
                        tuple("app1", "migration1"),
                        tuple("app1", "migration2"),
                        tuple("app2", "migration1"));
    }

    @Test
    void sort_respectsDependenciesAcrossGroups() {
        MigrationRecord app2Before = migration("app2", "migration_before");
        MigrationRecord app2After = migration("app2", "migration_after",
                Dependency.onMigration("app2", "migration_before"));
        MigrationRecord app1Before = migration("app1", "migration_before",
                Dependency.onMigration("app2", "migration_before"));
        MigrationRecord app1After = migration("app1", "migration_after",
                Dependency.onMigration("app1", "migration_before"),
                Dependency.onMigration("app2", "migration_after"));

        List<MigrationRecord> sorted = sorter.sort(List.of(app2Before, app2After, app1Before, app1After));

        assertThat(sorted).containsExactly(app2Before, app2After, app1Before, app1After);
    }

    @Test
    void sort_resolvesModelDependencies() {
        MigrationRecord orders = migration("shop", "m_0001_initial", Dependency.onModel("crm", "customer"));
        MigrationRecord customers = creating("crm", "m_0001_initial", "customer");

        List<MigrationRecord> sorted = sorter.sort(List.of(orders, customers));

        assertThat(sorted).containsExactly(customers, orders);
    }

    @Test
    void sort_longChain() {
        List<MigrationRecord> migrations = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            List<Dependency> dependencies = new ArrayList<>();
            for (int j = 0; j < i; j++) {
                dependencies.add(Dependency.onMigration("app1", String.format("m%03d", j)));
            }
            migrations.add(migration("app1", String.format("m%03d", i), dependencies.toArray(Dependency[]::new)));
        }
        List<MigrationRecord> shuffled = new ArrayList<>(migrations);
        Collections.reverse(shuffled);

        assertThat(sorter.sort(shuffled)).isEqualTo(migrations);
    }

    @Test
    @DisplayName("식별자 순서와 반대인 긴 의존 체인도 정렬된다")
    void sort_veryLongChainAgainstIdentifierOrder() {
        int n = 20_000;
        List<MigrationRecord> migrations = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Dependency[] dependencies = i + 1 < n
                    ? new Dependency[]{Dependency.onMigration("app1", String.format("m%05d", i + 1))}
                    : new Dependency[0];
            migrations.add(migration("app1", String.format("m%05d", i), dependencies));
        }
        List<MigrationRecord> expected = new ArrayList<>(migrations);
        Collections.reverse(expected);

        assertThat(sorter.sort(migrations)).isEqualTo(expected);
    }

    @Test
    void sort_doesNotModifyInput() {
        List<MigrationRecord> input = List.of(migration("app1", "b"), migration("app1", "a"));

        sorter.sort(input);

        assertThat(input).extracting(Migration::getMigrationIdentifier).containsExactly("b", "a");
    }

    @Test
    void cycle_isDetected() {
        MigrationRecord first = creating("app1", "migration1", "model1", Dependency.onMigration("app1", "migration2"));
        MigrationRecord second = creating("app1", "migration2", "model2", Dependency.onMigration("app1", "migration1"));

        MigrationSorterException e = assertThrows(MigrationSorterException.class,
                () -> sorter.sort(List.of(first, second)));

        assertEquals(MigrationSorterException.Reason.CYCLE_DETECTED, e.getReason());
        assertEquals("app1", e.getGroupIdentifier());
    }

    @Test
    void duplicateMigration_isRejected() {
        MigrationSorterException e = assertThrows(MigrationSorterException.class,
                () -> sorter.sort(List.of(migration("app1", "migration1"), migration("app1", "migration1"))));

        assertEquals(MigrationSorterException.Reason.DUPLICATE_MIGRATION, e.getReason());
        assertEquals("app1", e.getGroupIdentifier());
        assertEquals("migration1", e.getIdentifier());
    }

    @Test
    void duplicateModel_isRejected() {
        MigrationSorterException e = assertThrows(MigrationSorterException.class,
                () -> sorter.sort(List.of(
                        creating("app1", "migration1", "model1"),
                        creating("app1", "migration2", "model1"))));

        assertEquals(MigrationSorterException.Reason.DUPLICATE_MODEL, e.getReason());
        assertEquals("app1", e.getGroupIdentifier());
        assertEquals("model1", e.getIdentifier());
    }

    @Test
    void sameTableInDifferentGroups_isAllowed() {
        List<MigrationRecord> sorted = sorter.sort(List.of(
                creating("app1", "migration1", "model1"),
                creating("app2", "migration1", "model1")));

        assertThat(sorted).hasSize(2);
    }

    @Test
    void invalidDependency_isRejected() {
        MigrationSorterException e = assertThrows(MigrationSorterException.class,
                () -> sorter.sort(List.of(migration("app1", "migration1", Dependency.onModel("app2", "missing")))));

        assertEquals(MigrationSorterException.Reason.INVALID_DEPENDENCY, e.getReason());
        assertThat(e.getMessage()).contains("app2::missing").contains("app1::migration1");
    }

    @Test
    @DisplayName("Migration 인터페이스만 구현하면 정렬할 수 있다")
    void sort_acceptsAnyMigrationImplementation() {
        Migration base = mock(Migration.class);
        when(base.getGroupIdentifier()).thenReturn("app1");
        when(base.getMigrationIdentifier()).thenReturn("z_base");
        when(base.getDependencies()).thenReturn(List.of());

        Migration dependent = mock(Migration.class);
        when(dependent.getGroupIdentifier()).thenReturn("app1");
        when(dependent.getMigrationIdentifier()).thenReturn("a_dependent");
        when(dependent.getDependencies()).thenReturn(List.of(Dependency.onMigration("app1", "z_base")));

        assertThat(sorter.sort(List.of(dependent, base))).containsExactly(base, dependent);
    }
}
