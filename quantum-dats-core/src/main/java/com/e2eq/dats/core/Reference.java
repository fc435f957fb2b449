package com.e2eq.dats.core;

import java.util.Objects;

/**
 * Stands in for a node's identity instead of its content. Usable anywhere a property value is expected;
 * it serializes as a minimal {@code {"@type", "@id"}} object and never causes its target to be emitted.
 */
public record Reference(String identity, String type) {
    public Reference {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(type, "type");
    }
}
