package org.strata.migration.sorter;

import org.strata.migration.graph.CycleDetectedException;
import org.strata.migration.graph.DirectedGraph;
import org.strata.model.Migration;
import org.strata.model.dependency.Dependency;
import org.strata.model.dependency.DependencyVisitor;
import org.strata.model.dependency.OnMigration;
import org.strata.model.dependency.OnModel;
import org.strata.model.operation.CreateModel;
import org.strata.model.operation.Operation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders migrations so that every migration comes after everything it depends on.
 * <p>
 * Migrations are first sorted by {@code (group, identifier)}; the topological sort keeps
 * that order wherever dependencies allow it, so the result is reproducible. The same routine
 * serves the planner (to find the previous migration) and anything that applies migrations.
 */
public class MigrationSorter {

    private static final Comparator<Migration> BY_GROUP_AND_IDENTIFIER = Comparator
            .comparing(Migration::getGroupIdentifier)
            .thenComparing(Migration::getMigrationIdentifier);

    /**
     * @return a new list in application order
     * @throws MigrationSorterException on duplicates, unknown dependencies or cycles
     */
    public <T extends Migration> List<T> sort(Collection<T> migrations) {
        Objects.requireNonNull(migrations, "migrations must not be null");

        List<T> sorted = new ArrayList<>(migrations);
        sorted.sort(BY_GROUP_AND_IDENTIFIER);

        Map<LookupKey, Integer> lookup = createLookupTable(sorted);
        DirectedGraph graph = new DirectedGraph(sorted.size());
        for (int index = 0; index < sorted.size(); index++) {
            T migration = sorted.get(index);
            for (Dependency dependency : migration.getDependencies()) {
                Integer dependencyIndex = lookup.get(LookupKey.of(dependency));
                if (dependencyIndex == null) {
                    throw new MigrationSorterException(MigrationSorterException.Reason.INVALID_DEPENDENCY,
                            migration.getGroupIdentifier(), migration.getMigrationIdentifier(),
                            "Dependency not found: " + dependency + " (required by "
                                    + describe(migration) + ")");
                }
                graph.addEdge(dependencyIndex, index);
            }
        }

        List<Integer> order;
        try {
            order = graph.toposort();
        } catch (CycleDetectedException e) {
            T involved = sorted.get(e.getVertex());
            throw new MigrationSorterException(MigrationSorterException.Reason.CYCLE_DETECTED,
                    involved.getGroupIdentifier(), involved.getMigrationIdentifier(),
                    "Cycle detected in migrations involving " + describe(involved), e);
        }

        List<T> result = new ArrayList<>(sorted.size());
        for (int index : order) {
            result.add(sorted.get(index));
        }
        return result;
    }

    private static Map<LookupKey, Integer> createLookupTable(List<? extends Migration> migrations) {
        Map<LookupKey, Integer> lookup = new HashMap<>();
        for (int index = 0; index < migrations.size(); index++) {
            Migration migration = migrations.get(index);
            String group = migration.getGroupIdentifier();

            if (lookup.put(LookupKey.migration(group, migration.getMigrationIdentifier()), index) != null) {
                throw new MigrationSorterException(MigrationSorterException.Reason.DUPLICATE_MIGRATION,
                        group, migration.getMigrationIdentifier(),
                        "Migration defined twice: " + describe(migration));
            }

            for (Operation operation : migration.getOperations()) {
                if (operation instanceof CreateModel create
                        && lookup.put(LookupKey.model(group, create.tableName()), index) != null) {
                    throw new MigrationSorterException(MigrationSorterException.Reason.DUPLICATE_MODEL,
                            group, create.tableName(),
                            "Migration creating model defined twice: " + group + "::" + create.tableName());
                }
            }
        }
        return lookup;
    }

    private static String describe(Migration migration) {
        return migration.getGroupIdentifier() + "::" + migration.getMigrationIdentifier();
    }

    private record LookupKey(Kind kind, String group, String name) {
        enum Kind { MIGRATION, MODEL }

        static LookupKey migration(String group, String identifier) {
            return new LookupKey(Kind.MIGRATION, group, identifier);
        }

        static LookupKey model(String group, String tableName) {
            return new LookupKey(Kind.MODEL, group, tableName);
        }

        static LookupKey of(Dependency dependency) {
            return dependency.accept(new DependencyVisitor<>() {
                @Override
                public LookupKey visitMigration(OnMigration d) {
                    return migration(d.groupIdentifier(), d.migrationIdentifier());
                }

                @Override
                public LookupKey visitModel(OnModel d) {
                    return model(d.groupIdentifier(), d.tableName());
                }
            });
        }
    }
}
