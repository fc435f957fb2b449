package com.e2eq.dats.core;

/**
 * One step of a {@link JoinChain}.
 *
 * @param label         column name bound by this step, unique within the chain
 * @param from          label of the earlier step this one walks from; null for the first step
 * @param predicate     edge label to follow; null for the first step
 * @param target        accepted objects
 * @param requiredValue when set, the bound identity or literal must equal it
 * @param parameter     when set, the bound value must equal the query parameter of that name
 */
public record JoinStep(String label,
                       String from,
                       String predicate,
                       TypeFilter target,
                       String requiredValue,
                       String parameter) {

    public static JoinStep start(String label, String type) {
        return new JoinStep(label, null, null, TypeFilter.ofType(type), null, null);
    }

    public boolean isStart() {
        return predicate == null;
    }

    public boolean isConstrained() {
        return requiredValue != null || parameter != null;
    }

    JoinStep withFrom(String from) {
        return new JoinStep(label, from, predicate, target, requiredValue, parameter);
    }

    JoinStep withRequiredValue(String value) {
        return new JoinStep(label, from, predicate, target, value, parameter);
    }

    JoinStep withParameter(String name) {
        return new JoinStep(label, from, predicate, target, requiredValue, name);
    }

    @Override
    public String toString() {
        return isStart() ? label + ":" + target : label + ":" + from + " -" + predicate + "-> " + target;
    }
}
