package org.strata.migration.state;

import lombok.EqualsAndHashCode;
import org.strata.model.FieldDescriptor;
import org.strata.model.ModelDescriptor;
import org.strata.model.operation.AddField;
import org.strata.model.operation.CreateModel;
import org.strata.model.operation.Operation;
import org.strata.model.operation.OperationVisitor;
import org.strata.model.operation.RemoveField;
import org.strata.model.operation.RemoveModel;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory schema (tables and their columns) that operations can be applied to, forwards and
 * backwards, without a database. Used to check that a plan is executable and reversible.
 * <p>
 * Column order is not part of equality; foreign keys are not checked against the referenced
 * table.
 */
@EqualsAndHashCode
public class SchemaState {
    private final Map<String, Map<String, FieldDescriptor>> tables = new TreeMap<>();

    public static SchemaState empty() {
        return new SchemaState();
    }

    public static SchemaState of(Collection<ModelDescriptor> models) {
        SchemaState state = new SchemaState();
        for (ModelDescriptor model : models) {
            state.createTable(model.getTableName(), model.getFields());
        }
        return state;
    }

    public Set<String> tableNames() {
        return Collections.unmodifiableSet(tables.keySet());
    }

    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    public Map<String, FieldDescriptor> columns(String tableName) {
        return Collections.unmodifiableMap(requireTable(tableName));
    }

    public SchemaState apply(Operation operation) {
        operation.accept(forwards);
        return this;
    }

    public SchemaState revert(Operation operation) {
        operation.accept(backwards);
        return this;
    }

    public SchemaState applyAll(List<Operation> operations) {
        operations.forEach(this::apply);
        return this;
    }

    /**
     * Reverts the operations last to first, i.e. undoes {@link #applyAll(List)}.
     */
    public SchemaState revertAll(List<Operation> operations) {
        for (int i = operations.size() - 1; i >= 0; i--) {
            revert(operations.get(i));
        }
        return this;
    }

    @EqualsAndHashCode.Exclude
    private final OperationVisitor<Void> forwards = new OperationVisitor<>() {
        @Override
        public Void visitCreateModel(CreateModel op) {
            createTable(op.tableName(), op.fields());
            return null;
        }

        @Override
        public Void visitAddField(AddField op) {
            addColumn(op.tableName(), op.field());
            return null;
        }

        @Override
        public Void visitRemoveField(RemoveField op) {
            dropColumn(op.tableName(), op.field().getColumnName());
            return null;
        }

        @Override
        public Void visitRemoveModel(RemoveModel op) {
            dropTable(op.tableName());
            return null;
        }
    };

    @EqualsAndHashCode.Exclude
    private final OperationVisitor<Void> backwards = new OperationVisitor<>() {
        @Override
        public Void visitCreateModel(CreateModel op) {
            dropTable(op.tableName());
            return null;
        }

        @Override
        public Void visitAddField(AddField op) {
            dropColumn(op.tableName(), op.field().getColumnName());
            return null;
        }

        @Override
        public Void visitRemoveField(RemoveField op) {
            addColumn(op.tableName(), op.field());
            return null;
        }

        @Override
        public Void visitRemoveModel(RemoveModel op) {
            createTable(op.tableName(), op.fields());
            return null;
        }
    };

    private void createTable(String tableName, List<FieldDescriptor> fields) {
        if (tables.containsKey(tableName)) {
            throw new IllegalStateException("Table '" + tableName + "' already exists");
        }
        Map<String, FieldDescriptor> columns = new LinkedHashMap<>();
        tables.put(tableName, columns);
        for (FieldDescriptor field : fields) {
            addColumn(tableName, field);
        }
    }

    private void dropTable(String tableName) {
        requireTable(tableName);
        tables.remove(tableName);
    }

    private void addColumn(String tableName, FieldDescriptor field) {
        Map<String, FieldDescriptor> columns = requireTable(tableName);
        if (columns.putIfAbsent(field.getColumnName(), field) != null) {
            throw new IllegalStateException("Column '" + field.getColumnName() + "' already exists in '" + tableName + "'");
        }
    }

    private void dropColumn(String tableName, String columnName) {
        Map<String, FieldDescriptor> columns = requireTable(tableName);
        if (columns.remove(columnName) == null) {
            throw new IllegalStateException("Column '" + columnName + "' does not exist in '" + tableName + "'");
        }
    }

    private Map<String, FieldDescriptor> requireTable(String tableName) {
        Map<String, FieldDescriptor> columns = tables.get(tableName);
        if (columns == null) {
            throw new IllegalStateException("Table '" + tableName + "' does not exist");
        }
        return columns;
    }

    @Override
    public String toString() {
        Map<String, Set<String>> summary = new TreeMap<>();
        tables.forEach((table, columns) -> summary.put(table, columns.keySet()));
        return "SchemaState" + summary;
    }
}
