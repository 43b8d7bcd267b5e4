package com.solast.json;

/**
 * Shape of the emitted documents.
 */
public enum SchemaVariant {
    /**
     * Flat objects: {@code id}, {@code src}, {@code nodeType} followed by the kind's attributes.
     */
    CURRENT,

    /**
     * The older envelope: {@code id}, {@code src}, {@code name} (the node type), an {@code attributes}
     * object holding every non-embedded attribute, and a {@code children} array holding the embedded
     * child documents in attribute order.
     */
    LEGACY
}
