package org.strata.model.operation;

public interface OperationVisitor<R> {
    R visitCreateModel(CreateModel operation);
    R visitAddField(AddField operation);
    R visitRemoveField(RemoveField operation);
    R visitRemoveModel(RemoveModel operation);
}
