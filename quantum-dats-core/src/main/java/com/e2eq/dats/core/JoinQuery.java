package com.e2eq.dats.core;

import java.util.*;

/**
 * A join chain plus everything needed to run it once: an optional identity the first step must start at,
 * parameter values, the projected columns and the sort columns.
 *
 * @param chain   the steps to evaluate
 * @param startAt identity the first step is restricted to, or null for every node of the start type
 * @param params  values for the parameters referenced by the steps
 * @param select  projected step labels, in output order
 * @param orderBy leading sort columns; the remaining selected columns break ties
 */
public record JoinQuery(JoinChain chain,
                        String startAt,
                        Map<String, String> params,
                        List<String> select,
                        List<String> orderBy) {

    public JoinQuery {
        Objects.requireNonNull(chain, "chain");
        params = params == null ? Map.of() : Map.copyOf(params);
        select = select == null || select.isEmpty() ? chain.labels() : List.copyOf(select);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        for (String label : select) {
            JoinChain.require(chain.hasLabel(label), "Selected column '" + label + "' is not a step label");
        }
        for (String label : orderBy) {
            JoinChain.require(select.contains(label), "Sort column '" + label + "' is not selected");
        }
    }

    public static JoinQuery of(JoinChain chain) {
        return new JoinQuery(chain, null, Map.of(), List.of(), List.of());
    }

    public static Builder builder(JoinChain chain) {
        return new Builder(chain);
    }

    public static final class Builder {
        private final JoinChain chain;
        private String startAt;
        private final Map<String, String> params = new LinkedHashMap<>();
        private final List<String> select = new ArrayList<>();
        private final List<String> orderBy = new ArrayList<>();

        private Builder(JoinChain chain) {
            this.chain = chain;
        }

        public Builder startAt(String identity) {
            this.startAt = identity;
            return this;
        }

        public Builder param(String name, String value) {
            params.put(name, value);
            return this;
        }

        public Builder params(Map<String, String> values) {
            params.putAll(values);
            return this;
        }

        public Builder select(String... labels) {
            select.addAll(Arrays.asList(labels));
            return this;
        }

        public Builder select(List<String> labels) {
            select.addAll(labels);
            return this;
        }

        public Builder orderBy(String... labels) {
            orderBy.addAll(Arrays.asList(labels));
            return this;
        }

        public Builder orderBy(List<String> labels) {
            orderBy.addAll(labels);
            return this;
        }

        public JoinQuery build() {
            return new JoinQuery(chain, startAt, params, select, orderBy);
        }
    }
}
