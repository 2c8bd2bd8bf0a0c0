package org.strata.model.operation;

import org.strata.model.FieldDescriptor;
import org.strata.model.ModelDescriptor;

import java.util.List;
import java.util.Objects;

public record CreateModel(String tableName, String typeIdentifier, List<FieldDescriptor> fields) implements Operation {

    public CreateModel {
        Objects.requireNonNull(tableName, "tableName must not be null");
        Objects.requireNonNull(typeIdentifier, "typeIdentifier must not be null");
        fields = List.copyOf(fields);
    }

    public static CreateModel of(ModelDescriptor model) {
        return new CreateModel(model.getTableName(), model.getTypeIdentifier(), model.getFields());
    }

    /**
     * 특정 타입을 참조하는 FK 필드 목록
     */
    public List<FieldDescriptor> foreignKeysTo(String targetType) {
        return fields.stream().filter(f -> f.isForeignKeyTo(targetType)).toList();
    }

    /**
     * Same table without the foreign keys pointing at {@code targetType}.
     */
    public CreateModel withoutForeignKeysTo(String targetType) {
        return new CreateModel(tableName, typeIdentifier,
                fields.stream().filter(f -> !f.isForeignKeyTo(targetType)).toList());
    }

    @Override
    public OperationType type() {
        return OperationType.CREATE_MODEL;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitCreateModel(this);
    }
}
