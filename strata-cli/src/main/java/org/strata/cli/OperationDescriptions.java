package org.strata.cli;

import org.strata.model.operation.AddField;
import org.strata.model.operation.CreateModel;
import org.strata.model.operation.Operation;
import org.strata.model.operation.OperationVisitor;
import org.strata.model.operation.RemoveField;
import org.strata.model.operation.RemoveModel;

/**
 * One-line, human readable form of an operation for console output.
 */
final class OperationDescriptions implements OperationVisitor<String> {

    private static final OperationDescriptions INSTANCE = new OperationDescriptions();

    private OperationDescriptions() {
    }

    static String describe(Operation operation) {
        return operation.accept(INSTANCE);
    }

    @Override
    public String visitCreateModel(CreateModel operation) {
        return "Create model '" + operation.tableName() + "' (" + operation.fields().size() + " fields)";
    }

    @Override
    public String visitAddField(AddField operation) {
        return "Add field '" + operation.field().getColumnName() + "' to model '" + operation.tableName() + "'";
    }

    @Override
    public String visitRemoveField(RemoveField operation) {
        return "Remove field '" + operation.field().getColumnName() + "' from model '" + operation.tableName() + "'";
    }

    @Override
    public String visitRemoveModel(RemoveModel operation) {
        return "Remove model '" + operation.tableName() + "'";
    }
}
