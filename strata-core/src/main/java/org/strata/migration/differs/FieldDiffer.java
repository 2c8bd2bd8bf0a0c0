package org.strata.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.strata.model.FieldDescriptor;
import org.strata.model.ModelDescriptor;
import org.strata.model.operation.AddField;
import org.strata.model.operation.Operation;
import org.strata.model.operation.RemoveField;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Column level comparison of two versions of the same table.
 */
@Slf4j
public class FieldDiffer {

    public List<Operation> diff(ModelDescriptor current, ModelDescriptor snapshot) {
        Map<String, FieldDescriptor> currentFields = current.getFieldsByColumn();
        Map<String, FieldDescriptor> snapshotFields = snapshot.getFieldsByColumn();

        // 해시 순서에 의존하지 않도록 컬럼명 정렬
        SortedSet<String> columnNames = new TreeSet<>(currentFields.keySet());
        columnNames.addAll(snapshotFields.keySet());

        List<Operation> operations = new ArrayList<>();
        for (String column : columnNames) {
            FieldDescriptor currentField = currentFields.get(column);
            FieldDescriptor snapshotField = snapshotFields.get(column);

            if (snapshotField == null) {
                log.debug("Adding field '{}' to model '{}'", column, current.getTableName());
                operations.add(new AddField(current.getTableName(), current.getTypeIdentifier(), currentField));
            } else if (currentField == null) {
                log.debug("Removing field '{}' from model '{}'", column, snapshot.getTableName());
                // 되돌리기를 위해 스냅샷 쪽 필드를 보관
                operations.add(new RemoveField(snapshot.getTableName(), snapshot.getTypeIdentifier(), snapshotField));
            } else if (!currentField.equals(snapshotField)) {
                throw new UnsupportedFieldChangeException(current.getTableName(), snapshotField, currentField);
            }
        }
        return operations;
    }
}
