package org.strata.model.dependency;

public interface DependencyVisitor<R> {
    R visitMigration(OnMigration dependency);
    R visitModel(OnModel dependency);
}
