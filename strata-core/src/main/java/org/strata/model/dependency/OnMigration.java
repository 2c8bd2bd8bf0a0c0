package org.strata.model.dependency;

import java.util.Objects;

/**
 * The owning migration must be applied after {@code groupIdentifier::migrationIdentifier}.
 */
public record OnMigration(String groupIdentifier, String migrationIdentifier) implements Dependency {

    public OnMigration {
        Objects.requireNonNull(groupIdentifier, "groupIdentifier must not be null");
        Objects.requireNonNull(migrationIdentifier, "migrationIdentifier must not be null");
    }

    @Override
    public <R> R accept(DependencyVisitor<R> visitor) {
        return visitor.visitMigration(this);
    }

    @Override
    public String toString() {
        return "migration " + groupIdentifier + "::" + migrationIdentifier;
    }
}
