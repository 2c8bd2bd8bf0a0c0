package org.strata.migration.sorter;

import lombok.Getter;
import org.strata.migration.MigrationPlanningException;

/**
 * The set of finalized migrations cannot be put into a valid order.
 */
@Getter
public class MigrationSorterException extends MigrationPlanningException {

    public enum Reason {
        /** Migrations depend on each other, directly or transitively. */
        CYCLE_DETECTED,
        /** A dependency names a migration or model no known migration provides. */
        INVALID_DEPENDENCY,
        /** Two migrations share a group and identifier. */
        DUPLICATE_MIGRATION,
        /** Two migrations of one group both create the same table. */
        DUPLICATE_MODEL
    }

    private final Reason reason;
    private final String groupIdentifier;
    private final String identifier;

    public MigrationSorterException(Reason reason, String groupIdentifier, String identifier, String message) {
        super(message);
        this.reason = reason;
        this.groupIdentifier = groupIdentifier;
        this.identifier = identifier;
    }

    public MigrationSorterException(Reason reason, String groupIdentifier, String identifier, String message,
                                    Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.groupIdentifier = groupIdentifier;
        this.identifier = identifier;
    }
}
