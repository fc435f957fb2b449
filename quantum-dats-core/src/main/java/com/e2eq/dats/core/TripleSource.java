package com.e2eq.dats.core;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookups the join engine needs over a loaded graph.
 * {@link TripleIndex} is the in-memory implementation.
 */
public interface TripleSource {

    // All triples whose subject is the given identity, in document order
    List<Triple> outgoing(String subject);

    List<Triple> outgoing(String subject, String predicate);

    // Identities declared with the given type tag, in document order
    List<String> subjectsOfType(String type);

    Optional<String> typeOf(String identity);

    Set<String> subjects();
}
