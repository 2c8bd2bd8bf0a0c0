package org.strata.migration;

import lombok.Getter;

@Getter
public class InvalidMigrationNameException extends MigrationPlanningException {
    private final String migrationIdentifier;

    public InvalidMigrationNameException(String migrationIdentifier, String reason) {
        super("Unable to parse migration number from '" + migrationIdentifier + "': " + reason);
        this.migrationIdentifier = migrationIdentifier;
    }

    public InvalidMigrationNameException(String migrationIdentifier, Throwable cause) {
        super("Unable to parse migration number from '" + migrationIdentifier + "'", cause);
        this.migrationIdentifier = migrationIdentifier;
    }
}
