package org.strata.model.operation;

public enum OperationType {
    CREATE_MODEL, ADD_FIELD, REMOVE_FIELD, REMOVE_MODEL
}
