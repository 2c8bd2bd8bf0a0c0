package org.strata.migration;

import org.strata.model.ModelDescriptor;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up models by type identifier. Models registered first win, so current declarations
 * shadow older snapshots of the same type.
 * <p>
 * Models registered with {@link #registerExternal(Collection)} resolve references but are not
 * created by any known migration, so nothing can depend on them.
 */
public class ModelCatalog {
    private final Map<String, ModelDescriptor> byType = new LinkedHashMap<>();
    private final Set<String> externalTypes = new HashSet<>();

    public ModelCatalog register(Collection<ModelDescriptor> models) {
        for (ModelDescriptor model : models) {
            byType.putIfAbsent(model.getTypeIdentifier(), model);
        }
        return this;
    }

    public ModelCatalog registerExternal(Collection<ModelDescriptor> models) {
        for (ModelDescriptor model : models) {
            if (byType.putIfAbsent(model.getTypeIdentifier(), model) == null) {
                externalTypes.add(model.getTypeIdentifier());
            }
        }
        return this;
    }

    public Optional<ModelDescriptor> find(String typeIdentifier) {
        return Optional.ofNullable(byType.get(typeIdentifier));
    }

    /**
     * @return {@code true} if the type is known only from an external model
     */
    public boolean isExternal(String typeIdentifier) {
        return externalTypes.contains(typeIdentifier);
    }

    public int size() {
        return byType.size();
    }
}
