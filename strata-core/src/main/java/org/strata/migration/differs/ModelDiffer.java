package org.strata.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.strata.model.ModelDescriptor;
import org.strata.model.operation.CreateModel;
import org.strata.model.operation.RemoveModel;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compares the models declared now with the latest migration snapshot and produces the raw
 * operation list. Output order follows table names, then column names, so two runs over the
 * same input always agree.
 */
@Slf4j
public class ModelDiffer {
    private final FieldDiffer fieldDiffer;

    public ModelDiffer() {
        this(new FieldDiffer());
    }

    public ModelDiffer(FieldDiffer fieldDiffer) {
        this.fieldDiffer = Objects.requireNonNull(fieldDiffer, "fieldDiffer must not be null");
    }

    public ModelDiff diff(Collection<ModelDescriptor> currentModels, Collection<ModelDescriptor> snapshotModels) {
        Objects.requireNonNull(currentModels, "currentModels must not be null");
        Objects.requireNonNull(snapshotModels, "snapshotModels must not be null");

        Map<String, ModelDescriptor> current = byTableName(currentModels, "current");
        Map<String, ModelDescriptor> snapshot = byTableName(snapshotModels, "snapshot");

        SortedSet<String> tableNames = new TreeSet<>(current.keySet());
        tableNames.addAll(snapshot.keySet());

        ModelDiff.ModelDiffBuilder result = ModelDiff.builder();
        for (String tableName : tableNames) {
            ModelDescriptor currentModel = current.get(tableName);
            ModelDescriptor snapshotModel = snapshot.get(tableName);

            if (snapshotModel == null) {
                log.debug("Creating model '{}'", tableName);
                result.operation(CreateModel.of(currentModel));
                result.modifiedModel(currentModel);
            } else if (currentModel == null) {
                log.debug("Removing model '{}'", tableName);
                result.operation(RemoveModel.of(snapshotModel));
            } else if (!currentModel.hasSameShape(snapshotModel)) {
                log.debug("Modifying model '{}'", tableName);
                result.operations(fieldDiffer.diff(currentModel, snapshotModel));
                result.modifiedModel(currentModel);
            }
        }
        return result.build();
    }

    private static Map<String, ModelDescriptor> byTableName(Collection<ModelDescriptor> models, String side) {
        Map<String, ModelDescriptor> byName = new LinkedHashMap<>();
        for (ModelDescriptor model : models) {
            if (byName.put(model.getTableName(), model) != null) {
                throw new IllegalArgumentException(
                        "Model '" + model.getTableName() + "' declared twice in " + side + " models");
            }
        }
        return byName;
    }
}
