package org.strata.model.operation;

import org.strata.model.FieldDescriptor;

import java.util.Objects;

/**
 * Drops a column. Carries the snapshot's field so the column can be recreated when the
 * migration is reverted.
 */
public record RemoveField(String tableName, String typeIdentifier, FieldDescriptor field) implements Operation {

    public RemoveField {
        Objects.requireNonNull(tableName, "tableName must not be null");
        Objects.requireNonNull(typeIdentifier, "typeIdentifier must not be null");
        Objects.requireNonNull(field, "field must not be null");
    }

    @Override
    public OperationType type() {
        return OperationType.REMOVE_FIELD;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitRemoveField(this);
    }
}
