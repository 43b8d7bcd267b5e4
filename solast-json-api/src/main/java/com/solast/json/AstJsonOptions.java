package com.solast.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of one converter: the schema variant and the table that maps source names
 * to the indices used in {@code src} strings.
 */
public final class AstJsonOptions {

    private static final AstJsonOptions DEFAULTS = builder().build();

    private final SchemaVariant schemaVariant;
    private final Map<String, Integer> sourceIndices;

    private AstJsonOptions(Builder builder) {
        this.schemaVariant = builder.schemaVariant;
        this.sourceIndices = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sourceIndices));
    }

    public static AstJsonOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SchemaVariant schemaVariant() {
        return schemaVariant;
    }

    public boolean isLegacy() {
        return schemaVariant == SchemaVariant.LEGACY;
    }

    public Map<String, Integer> sourceIndices() {
        return sourceIndices;
    }

    public Builder toBuilder() {
        return new Builder().schemaVariant(schemaVariant).sourceIndices(sourceIndices);
    }

    @Override
    public String toString() {
        return "AstJsonOptions{schemaVariant=" + schemaVariant + ", sourceIndices=" + sourceIndices + "}";
    }

    public static final class Builder {
        private SchemaVariant schemaVariant = SchemaVariant.CURRENT;
        private final Map<String, Integer> sourceIndices = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder schemaVariant(SchemaVariant schemaVariant) {
            this.schemaVariant = Objects.requireNonNull(schemaVariant, "schemaVariant");
            return this;
        }

        public Builder legacy(boolean legacy) {
            return schemaVariant(legacy ? SchemaVariant.LEGACY : SchemaVariant.CURRENT);
        }

        public Builder sourceIndex(String sourceName, int index) {
            Objects.requireNonNull(sourceName, "sourceName");
            if (index < 0) {
                throw new IllegalArgumentException("Source index must be non-negative: " + sourceName + " -> " + index);
            }
            sourceIndices.put(sourceName, index);
            return this;
        }

        public Builder sourceIndices(Map<String, Integer> indices) {
            indices.forEach(this::sourceIndex);
            return this;
        }

        public AstJsonOptions build() {
            return new AstJsonOptions(this);
        }
    }
}
