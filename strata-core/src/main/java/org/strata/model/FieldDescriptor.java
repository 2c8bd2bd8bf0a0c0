package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * One column of a model, as declared in source or as recorded in a migration snapshot.
 * Equality is structural over every attribute.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FieldDescriptor {
    String columnName;
    String typeIdentifier;
    boolean primaryKey;
    boolean autoGenerated;
    @Builder.Default boolean nullable = false;
    boolean unique;
    @Builder.Default String foreignKeyTarget = null; // 참조 대상 모델의 타입 식별자

    @JsonIgnore
    public Optional<String> getForeignKey() {
        return Optional.ofNullable(foreignKeyTarget);
    }

    public boolean isForeignKeyTo(String targetType) {
        return foreignKeyTarget != null && foreignKeyTarget.equals(targetType);
    }
}
