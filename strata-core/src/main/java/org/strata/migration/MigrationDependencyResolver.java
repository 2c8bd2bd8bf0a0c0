package org.strata.migration;

import org.strata.migration.graph.OperationReferences;
import org.strata.model.Migration;
import org.strata.model.ModelDescriptor;
import org.strata.model.dependency.Dependency;
import org.strata.model.operation.Operation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the dependencies of a new migration: the previous migration of its group, plus
 * one model dependency per foreign key target that the migration does not create itself.
 * Targets known only from external models resolve but add no dependency, since no loaded
 * migration creates them.
 */
public class MigrationDependencyResolver {
    private final ModelCatalog catalog;

    public MigrationDependencyResolver(ModelCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    public List<Dependency> resolve(List<Operation> operations, Optional<? extends Migration> previous) {
        List<Dependency> dependencies = new ArrayList<>();
        previous.ifPresent(p -> dependencies.add(
                Dependency.onMigration(p.getGroupIdentifier(), p.getMigrationIdentifier())));

        Map<String, Integer> createdHere = OperationReferences.providers(operations);
        // (group, table) 기준 중복 제거, 연산 순서 유지
        Set<Dependency> external = new LinkedHashSet<>();
        for (OperationReferences.Reference ref : OperationReferences.collect(operations)) {
            if (!ref.isForeignKey() || createdHere.containsKey(ref.targetType())) {
                continue;
            }
            Operation operation = operations.get(ref.operationIndex());
            ModelDescriptor target = catalog.find(ref.targetType())
                    .orElseThrow(() -> new UnresolvedReferenceException(
                            operation.tableName(), ref.field().getColumnName(), ref.targetType()));
            if (catalog.isExternal(ref.targetType())) {
                continue;
            }
            external.add(Dependency.onModel(target.getGroupIdentifier(), target.getTableName()));
        }
        dependencies.addAll(external);
        return dependencies;
    }
}
