package com.e2eq.dats.core;

import java.util.*;

/**
 * Rows of a join, already deduplicated and sorted. Each row holds one value per column:
 * a node identity or a literal.
 */
public record JoinResult(List<String> columns, List<List<String>> rows) {

    public JoinResult {
        columns = List.copyOf(columns);
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) copy.add(List.copyOf(row));
        rows = Collections.unmodifiableList(copy);
    }

    public static JoinResult empty(List<String> columns) {
        return new JoinResult(columns, List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<String> column(String name) {
        int idx = columns.indexOf(name);
        if (idx < 0) throw new IllegalArgumentException("Unknown column '" + name + "'");
        List<String> out = new ArrayList<>(rows.size());
        for (List<String> row : rows) out.add(row.get(idx));
        return out;
    }

    /**
     * Rows keyed by column name, in column order.
     */
    public List<Map<String, String>> asMaps() {
        List<Map<String, String>> out = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            Map<String, String> m = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) m.put(columns.get(i), row.get(i));
            out.add(m);
        }
        return out;
    }
}
