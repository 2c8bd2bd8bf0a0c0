package org.strata.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * The models declared by one group, as handed over by whatever extracts them from source.
 */
@Value
@Builder
@Jacksonized
public class ModelSet {
    String group;
    @Singular List<ModelDescriptor> models;
}
