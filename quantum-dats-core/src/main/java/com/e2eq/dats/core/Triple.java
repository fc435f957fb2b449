package com.e2eq.dats.core;

import java.util.Objects;

/**
 * One edge of a loaded graph document. {@code object} is a node identity when {@code literal} is false,
 * otherwise the textual form of a scalar value. Type tags are stored as literal triples with
 * predicate {@link #TYPE_PREDICATE}.
 */
public record Triple(String subject, String predicate, String object, boolean literal) {
    public static final String TYPE_PREDICATE = "@type";

    public Triple {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(object, "object");
    }

    public static Triple node(String subject, String predicate, String objectIdentity) {
        return new Triple(subject, predicate, objectIdentity, false);
    }

    public static Triple literal(String subject, String predicate, String value) {
        return new Triple(subject, predicate, value, true);
    }

    public boolean isTypeTriple() {
        return TYPE_PREDICATE.equals(predicate);
    }
}
