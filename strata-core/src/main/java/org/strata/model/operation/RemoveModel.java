package org.strata.model.operation;

import org.strata.model.FieldDescriptor;
import org.strata.model.ModelDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * Drops a table. Carries every snapshot field so that reverting recreates it exactly.
 */
public record RemoveModel(String tableName, String typeIdentifier, List<FieldDescriptor> fields) implements Operation {

    public RemoveModel {
        Objects.requireNonNull(tableName, "tableName must not be null");
        Objects.requireNonNull(typeIdentifier, "typeIdentifier must not be null");
        fields = List.copyOf(fields);
    }

    public static RemoveModel of(ModelDescriptor model) {
        return new RemoveModel(model.getTableName(), model.getTypeIdentifier(), model.getFields());
    }

    @Override
    public OperationType type() {
        return OperationType.REMOVE_MODEL;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitRemoveModel(this);
    }
}
