package com.e2eq.dats.core;

import java.util.*;

/**
 * Wraps a {@link TripleSource} and counts {@code outgoing(subject, predicate)} calls per pair,
 * to assert that the join engine queries each pair at most once.
 */
public class CountingTripleSourceTestDouble implements TripleSource {

    private final TripleSource delegate;
    private final Map<List<String>, Integer> queryCounts = new HashMap<>();

    public CountingTripleSourceTestDouble(TripleSource delegate) {
        this.delegate = delegate;
    }

    public int getQueryCount(String subject, String predicate) {
        return queryCounts.getOrDefault(List.of(subject, predicate), 0);
    }

    public int totalQueries() {
        return queryCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public List<Triple> outgoing(String subject) {
        return delegate.outgoing(subject);
    }

    @Override
    public List<Triple> outgoing(String subject, String predicate) {
        queryCounts.merge(List.of(subject, predicate), 1, Integer::sum);
        return delegate.outgoing(subject, predicate);
    }

    @Override
    public List<String> subjectsOfType(String type) {
        return delegate.subjectsOfType(type);
    }

    @Override
    public Optional<String> typeOf(String identity) {
        return delegate.typeOf(identity);
    }

    @Override
    public Set<String> subjects() {
        return delegate.subjects();
    }
}
