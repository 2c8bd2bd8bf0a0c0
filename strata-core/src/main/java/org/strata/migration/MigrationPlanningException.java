package org.strata.migration;

/**
 * Base type of every failure caused by the planner's input rather than by a defect in the
 * planner itself. Callers may catch this to report a problem the user can fix.
 */
public class MigrationPlanningException extends RuntimeException {

    public MigrationPlanningException(String message) {
        super(message);
    }

    public MigrationPlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
