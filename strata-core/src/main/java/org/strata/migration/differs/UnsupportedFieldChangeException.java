package org.strata.migration.differs;

import lombok.Getter;
import org.strata.migration.MigrationPlanningException;
import org.strata.model.FieldDescriptor;

/**
 * Raised when an existing column changed its attributes. Altering columns is not supported;
 * the change has to be split by hand (for example remove and re-add under a new name).
 */
@Getter
public class UnsupportedFieldChangeException extends MigrationPlanningException {
    private final String tableName;
    private final String columnName;
    private final FieldDescriptor oldField;
    private final FieldDescriptor newField;

    public UnsupportedFieldChangeException(String tableName, FieldDescriptor oldField, FieldDescriptor newField) {
        super(String.format("Altering field '%s' of model '%s' is not supported (was %s, now %s)",
                newField.getColumnName(), tableName, oldField, newField));
        this.tableName = tableName;
        this.columnName = newField.getColumnName();
        this.oldField = oldField;
        this.newField = newField;
    }
}
