package org.strata.model.dependency;

import java.util.Objects;

/**
 * The owning migration must be applied after whichever migration creates
 * {@code groupIdentifier::tableName}.
 */
public record OnModel(String groupIdentifier, String tableName) implements Dependency {

    public OnModel {
        Objects.requireNonNull(groupIdentifier, "groupIdentifier must not be null");
        Objects.requireNonNull(tableName, "tableName must not be null");
    }

    @Override
    public <R> R accept(DependencyVisitor<R> visitor) {
        return visitor.visitModel(this);
    }

    @Override
    public String toString() {
        return "model " + groupIdentifier + "::" + tableName;
    }
}
