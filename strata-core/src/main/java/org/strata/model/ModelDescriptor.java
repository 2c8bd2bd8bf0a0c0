package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable shape of one table: the model declared in source right now, or the copy
 * embedded in a previously generated migration.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelDescriptor {
    String groupIdentifier;
    String tableName;
    String typeIdentifier;
    @Singular List<FieldDescriptor> fields;

    /**
     * 컬럼명 기준 필드 맵 (선언 순서 유지)
     *
     * @throws IllegalArgumentException 같은 컬럼명이 두 번 선언된 경우
     */
    @JsonIgnore
    public Map<String, FieldDescriptor> getFieldsByColumn() {
        Map<String, FieldDescriptor> byColumn = new LinkedHashMap<>();
        for (FieldDescriptor field : fields) {
            if (byColumn.put(field.getColumnName(), field) != null) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + field.getColumnName() + "' in model '" + tableName + "'");
            }
        }
        return Collections.unmodifiableMap(byColumn);
    }

    /**
     * Two descriptors of the same table are unchanged iff their fields, keyed by column
     * name, are equal. Field order does not matter.
     */
    public boolean hasSameShape(ModelDescriptor other) {
        return other != null && getFieldsByColumn().equals(other.getFieldsByColumn());
    }
}
