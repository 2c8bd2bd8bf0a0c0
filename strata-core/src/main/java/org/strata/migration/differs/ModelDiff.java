package org.strata.migration.differs;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.strata.model.ModelDescriptor;
import org.strata.model.operation.Operation;

import java.util.List;

/**
 * Raw, not yet ordered result of comparing current models with the last snapshot.
 */
@Builder
@Getter
public class ModelDiff {
    @Singular private final List<ModelDescriptor> modifiedModels;
    @Singular private final List<Operation> operations;

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
