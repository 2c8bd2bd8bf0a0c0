package org.strata.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.strata.model.dependency.Dependency;
import org.strata.model.operation.Operation;

import java.util.List;

/**
 * Output of one planning run, ready to be handed to whatever persists migrations.
 */
@Value
@Builder
public class GeneratedMigration implements Migration {
    String groupIdentifier;
    String migrationIdentifier;
    @Singular List<ModelDescriptor> modifiedModels;
    @Singular List<Dependency> dependencies;
    @Singular List<Operation> operations;

    /**
     * Freezes this migration into the stored form; the modified models become the
     * migration's snapshot.
     */
    public MigrationRecord toRecord() {
        return MigrationRecord.builder()
                .groupIdentifier(groupIdentifier)
                .migrationIdentifier(migrationIdentifier)
                .dependencies(dependencies)
                .operations(operations)
                .models(modifiedModels)
                .build();
    }
}
