package com.e2eq.dats.queries;

import com.e2eq.dats.core.JoinChain;
import com.e2eq.dats.core.JoinQuery;
import com.e2eq.dats.core.JoinStep;

import java.util.*;

/**
 * A named, parameterised join chain from the query catalog.
 * Parameters listed in {@code optionalParams} may be left unbound; their steps are then unconstrained.
 */
public record QueryDefinition(String id,
                              String description,
                              List<JoinStep> steps,
                              List<String> select,
                              List<String> orderBy,
                              Set<String> optionalParams) {

    public QueryDefinition {
        steps = List.copyOf(steps);
        select = select == null ? List.of() : List.copyOf(select);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        optionalParams = optionalParams == null ? Set.of() : Set.copyOf(optionalParams);
        // fail fast on an invalid definition
        build(steps, select, orderBy, optionalParams, Map.of());
    }

    /**
     * Binds {@code params} and produces an executable query.
     */
    public JoinQuery toQuery(Map<String, String> params) {
        return build(steps, select, orderBy, optionalParams, params);
    }

    private static JoinQuery build(List<JoinStep> steps, List<String> select, List<String> orderBy,
                                   Set<String> optionalParams, Map<String, String> params) {
        List<JoinStep> resolved = new ArrayList<>(steps.size());
        for (JoinStep s : steps) {
            boolean unbound = s.parameter() != null && !params.containsKey(s.parameter());
            if (unbound && optionalParams.contains(s.parameter())) {
                resolved.add(new JoinStep(s.label(), s.from(), s.predicate(), s.target(), s.requiredValue(), null));
            } else {
                resolved.add(s);
            }
        }
        return JoinQuery.builder(JoinChain.of(resolved))
                .params(params)
                .select(select)
                .orderBy(orderBy)
                .build();
    }

    public Set<String> parameters() {
        Set<String> out = new LinkedHashSet<>();
        for (JoinStep s : steps) if (s.parameter() != null) out.add(s.parameter());
        return out;
    }
}
