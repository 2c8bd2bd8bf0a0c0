package org.strata.migration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.strata.model.MigrationRecord;
import org.strata.model.ModelDescriptor;

import java.util.List;

/**
 * Everything one planning run needs.
 */
@Value
@Builder
public class PlanRequest {
    /** Group the new migration belongs to. */
    String groupIdentifier;
    /** Models declared in the group's source right now. */
    @Singular List<ModelDescriptor> currentModels;
    /** Finalized migrations; other groups may be included and are used to resolve references. */
    @Singular List<MigrationRecord> migrations;
    /** Models of other groups that are not covered by {@link #migrations}. */
    @Singular List<ModelDescriptor> externalModels;
}
