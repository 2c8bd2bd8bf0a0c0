package org.strata.model;

import org.strata.model.dependency.Dependency;
import org.strata.model.operation.Operation;

import java.util.List;

/**
 * Anything that can be ordered among other migrations: a finalized migration loaded from
 * storage, a freshly generated one, or a runtime wrapper.
 */
public interface Migration {

    String getGroupIdentifier();

    String getMigrationIdentifier();

    List<Dependency> getDependencies();

    /**
     * Operations of this migration. Only consulted to find which migration creates a
     * model, so implementations without operations may keep the default.
     */
    default List<Operation> getOperations() {
        return List.of();
    }
}
