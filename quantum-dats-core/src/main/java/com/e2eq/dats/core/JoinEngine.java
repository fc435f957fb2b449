package com.e2eq.dats.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Interpreter for {@link JoinQuery}s over a {@link TripleSource}.
 *
 * <p>The first step scans the start type; every later step extends each partial match through the
 * {@code (node, predicate)} lookup of the node bound by its {@code from} step, keeping the objects its
 * target filter and value constraint accept. Lookups are cached for the duration of one execution, so each
 * {@code (node, predicate)} pair hits the source at most once. A step that extends no partial match ends the
 * evaluation with an empty result.</p>
 *
 * <p>Rows are projected to the selected columns, deduplicated on the projected tuple and sorted by the
 * requested columns followed by the remaining ones, comparing values as strings. Identities are compared,
 * never document positions, so the order does not depend on how the document was built.</p>
 *
 * <p>The engine holds no state between executions.</p>
 */
@ApplicationScoped
public class JoinEngine {
    private static final Logger LOG = Logger.getLogger(JoinEngine.class);

    public JoinResult execute(JoinQuery query, TripleSource source) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(source, "source");
        JoinChain chain = query.chain();
        Map<String, String> params = query.params();
        for (String p : chain.parameters()) {
            JoinChain.require(params.containsKey(p), "Missing value for query parameter '" + p + "'");
        }

        Map<NodePred, List<Triple>> lookups = new HashMap<>();
        List<String[]> matches = startMatches(chain, query.startAt(), params, source);
        LOG.debugf("Join step %s: %d matches", chain.step(0), matches.size());

        for (int i = 1; i < chain.size() && !matches.isEmpty(); i++) {
            JoinStep step = chain.step(i);
            int fromIdx = chain.indexOf(step.from());
            String required = requiredValue(step, params);
            List<String[]> next = new ArrayList<>();
            for (String[] partial : matches) {
                String node = partial[fromIdx];
                for (Triple t : lookup(source, lookups, node, step.predicate())) {
                    if (!step.target().matches(t, source)) continue;
                    if (required != null && !required.equals(t.object())) continue;
                    String[] extended = partial.clone();
                    extended[i] = t.object();
                    next.add(extended);
                }
            }
            matches = next;
            LOG.debugf("Join step %s: %d matches", step, matches.size());
        }

        List<String> columns = query.select();
        if (matches.isEmpty()) {
            return JoinResult.empty(columns);
        }

        int[] projection = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) projection[c] = chain.indexOf(columns.get(c));

        Set<List<String>> unique = new LinkedHashSet<>();
        for (String[] m : matches) {
            List<String> row = new ArrayList<>(projection.length);
            for (int idx : projection) row.add(m[idx]);
            unique.add(row);
        }
        List<List<String>> rows = new ArrayList<>(unique);
        rows.sort(rowOrder(columns, query.orderBy()));
        LOG.debugf("Join produced %d rows (%d before dedup) with %d lookups", rows.size(), matches.size(), lookups.size());
        return new JoinResult(columns, rows);
    }

    private List<String[]> startMatches(JoinChain chain, String startAt, Map<String, String> params, TripleSource source) {
        JoinStep first = chain.step(0);
        String required = requiredValue(first, params);
        List<String[]> out = new ArrayList<>();
        for (String id : source.subjectsOfType(first.target().type())) {
            if (startAt != null && !startAt.equals(id)) continue;
            if (required != null && !required.equals(id)) continue;
            String[] m = new String[chain.size()];
            m[0] = id;
            out.add(m);
        }
        return out;
    }

    private static String requiredValue(JoinStep step, Map<String, String> params) {
        return step.parameter() != null ? params.get(step.parameter()) : step.requiredValue();
    }

    private static List<Triple> lookup(TripleSource source, Map<NodePred, List<Triple>> cache, String node, String p) {
        return cache.computeIfAbsent(new NodePred(node, p), k -> source.outgoing(node, p));
    }

    private static Comparator<List<String>> rowOrder(List<String> columns, List<String> orderBy) {
        List<Integer> keys = new ArrayList<>();
        for (String label : orderBy) keys.add(columns.indexOf(label));
        for (int c = 0; c < columns.size(); c++) if (!keys.contains(c)) keys.add(c);
        return (a, b) -> {
            for (int k : keys) {
                int cmp = a.get(k).compareTo(b.get(k));
                if (cmp != 0) return cmp;
            }
            return 0;
        };
    }

    private record NodePred(String node, String p) {}
}
