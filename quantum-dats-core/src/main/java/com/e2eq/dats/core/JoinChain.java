package com.e2eq.dats.core;

import java.util.*;

/**
 * Validated, immutable list of join steps. The first step scans a node type; every later step follows a
 * predicate from an earlier step (by default the one right before it), so a chain can describe a path
 * or a tree of paths sharing a prefix.
 *
 * <pre>{@code
 * JoinChain chain = JoinChain.start("subject", "Subject")
 *         .hop("group", "memberOf", "StudyGroup")
 *         .build();
 * }</pre>
 */
public final class JoinChain {
    private final List<JoinStep> steps;
    private final Map<String, Integer> indexByLabel;

    private JoinChain(List<JoinStep> steps) {
        this.steps = List.copyOf(steps);
        Map<String, Integer> idx = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) idx.put(steps.get(i).label(), i);
        this.indexByLabel = Collections.unmodifiableMap(idx);
    }

    /**
     * Validates {@code steps} and builds a chain. A step after the first without {@code from} walks from
     * the step right before it.
     *
     * @throws IllegalArgumentException when the steps do not form a valid chain
     */
    public static JoinChain of(List<JoinStep> steps) {
        require(steps != null && !steps.isEmpty(), "A join chain needs at least one step");
        List<JoinStep> resolved = new ArrayList<>(steps.size());
        Set<String> labels = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            JoinStep step = steps.get(i);
            require(step != null, "Step " + i + " is null");
            require(step.label() != null && !step.label().isBlank(), "Step " + i + " has no label");
            require(labels.add(step.label()), "Duplicate step label '" + step.label() + "'");
            require(step.target() != null, "Step '" + step.label() + "' has no target filter");
            require(step.requiredValue() == null || step.parameter() == null,
                    "Step '" + step.label() + "' cannot require both a value and a parameter");
            if (i == 0) {
                require(step.predicate() == null && step.from() == null,
                        "First step '" + step.label() + "' cannot follow a predicate");
                require(step.target().kind() == TypeFilter.Kind.NODE_TYPE,
                        "First step '" + step.label() + "' must name a node type");
                resolved.add(step);
                continue;
            }
            require(step.predicate() != null && !step.predicate().isBlank(),
                    "Step '" + step.label() + "' has no predicate");
            String from = step.from() != null ? step.from() : resolved.get(i - 1).label();
            JoinStep source = resolved.stream().filter(s -> s.label().equals(from)).findFirst().orElse(null);
            require(source != null, "Step '" + step.label() + "' walks from unknown or later step '" + from + "'");
            require(!source.target().isLiteral(),
                    "Step '" + step.label() + "' walks from literal step '" + from + "'");
            resolved.add(step.withFrom(from));
        }
        return new JoinChain(resolved);
    }

    public static Builder start(String label, String type) {
        return new Builder(JoinStep.start(label, type));
    }

    public List<JoinStep> steps() {
        return steps;
    }

    public JoinStep step(int index) {
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }

    public List<String> labels() {
        return List.copyOf(indexByLabel.keySet());
    }

    public boolean hasLabel(String label) {
        return indexByLabel.containsKey(label);
    }

    /**
     * @throws IllegalArgumentException for an unknown label
     */
    public int indexOf(String label) {
        Integer i = indexByLabel.get(label);
        require(i != null, "Unknown step label '" + label + "'");
        return i;
    }

    /**
     * Names of the query parameters the steps refer to.
     */
    public Set<String> parameters() {
        Set<String> out = new LinkedHashSet<>();
        for (JoinStep s : steps) if (s.parameter() != null) out.add(s.parameter());
        return out;
    }

    @Override
    public String toString() {
        return steps.toString();
    }

    static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }

    public static final class Builder {
        private final List<JoinStep> steps = new ArrayList<>();
        private String pendingFrom;

        private Builder(JoinStep first) {
            steps.add(first);
        }

        /**
         * The next step walks from {@code label} instead of the step right before it.
         */
        public Builder from(String label) {
            this.pendingFrom = label;
            return this;
        }

        public Builder hop(String label, String predicate, String type) {
            return add(new JoinStep(label, null, predicate, TypeFilter.ofType(type), null, null));
        }

        public Builder hopAny(String label, String predicate) {
            return add(new JoinStep(label, null, predicate, TypeFilter.anyNode(), null, null));
        }

        public Builder literal(String label, String predicate) {
            return add(new JoinStep(label, null, predicate, TypeFilter.literal(), null, null));
        }

        /**
         * Restricts the last added step to objects equal to {@code value}.
         */
        public Builder equalTo(String value) {
            return replaceLast(steps.get(steps.size() - 1).withRequiredValue(value));
        }

        /**
         * Restricts the last added step to objects equal to the query parameter {@code name}.
         */
        public Builder param(String name) {
            return replaceLast(steps.get(steps.size() - 1).withParameter(name));
        }

        public Builder step(JoinStep step) {
            return add(step);
        }

        public JoinChain build() {
            return JoinChain.of(steps);
        }

        private Builder add(JoinStep step) {
            steps.add(pendingFrom != null ? step.withFrom(pendingFrom) : step);
            pendingFrom = null;
            return this;
        }

        private Builder replaceLast(JoinStep step) {
            steps.set(steps.size() - 1, step);
            return this;
        }
    }
}
