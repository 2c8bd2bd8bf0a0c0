package org.strata.model.operation;

import org.strata.model.FieldDescriptor;

import java.util.Objects;

public record AddField(String tableName, String typeIdentifier, FieldDescriptor field) implements Operation {

    public AddField {
        Objects.requireNonNull(tableName, "tableName must not be null");
        Objects.requireNonNull(typeIdentifier, "typeIdentifier must not be null");
        Objects.requireNonNull(field, "field must not be null");
    }

    @Override
    public OperationType type() {
        return OperationType.ADD_FIELD;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAddField(this);
    }
}
