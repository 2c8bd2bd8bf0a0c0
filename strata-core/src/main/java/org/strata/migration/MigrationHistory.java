package org.strata.migration;

import org.strata.migration.sorter.MigrationSorter;
import org.strata.model.MigrationRecord;
import org.strata.model.ModelDescriptor;
import org.strata.model.operation.Operation;
import org.strata.model.operation.RemoveModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finalized migrations in application order, and the model snapshot they add up to.
 */
public class MigrationHistory {
    private final List<MigrationRecord> ordered;

    private MigrationHistory(List<MigrationRecord> ordered) {
        this.ordered = List.copyOf(ordered);
    }

    public static MigrationHistory of(Collection<MigrationRecord> migrations, MigrationSorter sorter) {
        return new MigrationHistory(sorter.sort(migrations));
    }

    public List<MigrationRecord> getMigrations() {
        return ordered;
    }

    public List<MigrationRecord> getMigrations(String groupIdentifier) {
        return ordered.stream()
                .filter(m -> m.getGroupIdentifier().equals(groupIdentifier))
                .toList();
    }

    public SortedSet<String> getGroups() {
        SortedSet<String> groups = new TreeSet<>();
        ordered.forEach(m -> groups.add(m.getGroupIdentifier()));
        return groups;
    }

    /**
     * The migration that was applied last in the given group.
     */
    public Optional<MigrationRecord> lastMigration(String groupIdentifier) {
        List<MigrationRecord> group = getMigrations(groupIdentifier);
        return group.isEmpty() ? Optional.empty() : Optional.of(group.get(group.size() - 1));
    }

    /**
     * Replays the group's migrations: each embedded model replaces earlier versions of its
     * table and a {@link RemoveModel} drops the table. Sorted by table name.
     */
    public List<ModelDescriptor> latestModels(String groupIdentifier) {
        TreeMap<String, ModelDescriptor> latest = new TreeMap<>();
        for (MigrationRecord migration : getMigrations(groupIdentifier)) {
            for (Operation operation : migration.getOperations()) {
                if (operation instanceof RemoveModel remove) {
                    latest.remove(remove.tableName());
                }
            }
            for (ModelDescriptor model : migration.getModels()) {
                latest.put(model.getTableName(), model);
            }
        }
        return new ArrayList<>(latest.values());
    }
}
