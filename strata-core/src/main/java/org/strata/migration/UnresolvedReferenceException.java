package org.strata.migration;

import lombok.Getter;

/**
 * A foreign key points at a type that is neither declared in the current group, recorded in
 * the migration history, nor supplied as an external model.
 */
@Getter
public class UnresolvedReferenceException extends MigrationPlanningException {
    private final String tableName;
    private final String columnName;
    private final String targetType;

    public UnresolvedReferenceException(String tableName, String columnName, String targetType) {
        super(String.format("Foreign key %s.%s references unknown model type '%s'",
                tableName, columnName, targetType));
        this.tableName = tableName;
        this.columnName = columnName;
        this.targetType = targetType;
    }
}
