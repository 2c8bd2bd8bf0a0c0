package org.strata.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.strata.model.dependency.Dependency;
import org.strata.model.operation.Operation;

import java.util.List;

/**
 * A finalized migration as stored on disk: its identity, dependencies, operations and the
 * model snapshot it introduced.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MigrationRecord implements Migration {
    String groupIdentifier;
    String migrationIdentifier;
    @Singular List<Dependency> dependencies;
    @Singular List<Operation> operations;
    @Singular List<ModelDescriptor> models;
}
