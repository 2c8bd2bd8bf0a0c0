package org.strata.migration.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.strata.model.GeneratedMigration;
import org.strata.model.MigrationRecord;
import org.strata.model.ModelSet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stores finalized migrations as JSON, one file per migration:
 * {@code <root>/<group>/<migrationIdentifier>.json}.
 */
@Slf4j
public class MigrationRepository {

    private static final String EXTENSION = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;

    public MigrationRepository(Path root) {
        this.root = root;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Loads the migrations of every group below the root. A missing root means no migrations.
     */
    public List<MigrationRecord> loadAll() throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<MigrationRecord> migrations = new ArrayList<>();
        try (Stream<Path> groups = Files.list(root)) {
            for (Path groupDir : groups.filter(Files::isDirectory).sorted().toList()) {
                migrations.addAll(loadGroup(groupDir));
            }
        }
        return migrations;
    }

    public List<MigrationRecord> loadGroup(String group) throws IOException {
        return loadGroup(root.resolve(group));
    }

    private List<MigrationRecord> loadGroup(Path groupDir) throws IOException {
        if (!Files.isDirectory(groupDir)) {
            return List.of();
        }
        List<MigrationRecord> migrations = new ArrayList<>();
        try (Stream<Path> files = Files.list(groupDir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(EXTENSION)).sorted().toList()) {
                MigrationRecord record = read(file);
                String expectedGroup = groupDir.getFileName().toString();
                if (!expectedGroup.equals(record.getGroupIdentifier())) {
                    log.warn("Migration {} declares group '{}' but is stored under '{}'",
                            file, record.getGroupIdentifier(), expectedGroup);
                }
                migrations.add(record);
            }
        }
        return migrations;
    }

    /**
     * Writes the migration and returns the path of the new file.
     *
     * @throws IOException if a migration with the same identifier already exists
     */
    public Path save(GeneratedMigration migration) throws IOException {
        Path groupDir = root.resolve(migration.getGroupIdentifier());
        Files.createDirectories(groupDir);

        Path file = groupDir.resolve(migration.getMigrationIdentifier() + EXTENSION);
        if (Files.exists(file)) {
            throw new IOException("Migration file already exists: " + file);
        }
        objectMapper.writeValue(file.toFile(), migration.toRecord());
        return file;
    }

    public String toJson(GeneratedMigration migration) throws IOException {
        return objectMapper.writeValueAsString(migration.toRecord());
    }

    public ModelSet loadModelSet(Path file) throws IOException {
        try {
            return objectMapper.readValue(file.toFile(), ModelSet.class);
        } catch (IOException e) {
            throw new IOException("Unable to read models from " + file + ": " + e.getMessage(), e);
        }
    }

    private MigrationRecord read(Path file) throws IOException {
        try {
            return objectMapper.readValue(file.toFile(), MigrationRecord.class);
        } catch (IOException e) {
            throw new IOException("Unable to read migration " + file + ": " + e.getMessage(), e);
        }
    }
}
