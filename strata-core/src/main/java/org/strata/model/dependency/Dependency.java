package org.strata.model.dependency;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Ordering constraint attached to a whole migration.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OnMigration.class, name = "MIGRATION"),
        @JsonSubTypes.Type(value = OnModel.class, name = "MODEL")
})
public sealed interface Dependency permits OnMigration, OnModel {

    String groupIdentifier();

    <R> R accept(DependencyVisitor<R> visitor);

    static Dependency onMigration(String groupIdentifier, String migrationIdentifier) {
        return new OnMigration(groupIdentifier, migrationIdentifier);
    }

    static Dependency onModel(String groupIdentifier, String tableName) {
        return new OnModel(groupIdentifier, tableName);
    }
}
