package org.strata.model.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A single reversible schema change. The set of kinds is closed; consumers dispatch through
 * {@link OperationVisitor} so a new kind cannot be added without updating all of them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CreateModel.class, name = "CREATE_MODEL"),
        @JsonSubTypes.Type(value = AddField.class, name = "ADD_FIELD"),
        @JsonSubTypes.Type(value = RemoveField.class, name = "REMOVE_FIELD"),
        @JsonSubTypes.Type(value = RemoveModel.class, name = "REMOVE_MODEL")
})
public sealed interface Operation permits CreateModel, AddField, RemoveField, RemoveModel {

    String tableName();

    String typeIdentifier();

    @JsonIgnore
    OperationType type();

    <R> R accept(OperationVisitor<R> visitor);
}
