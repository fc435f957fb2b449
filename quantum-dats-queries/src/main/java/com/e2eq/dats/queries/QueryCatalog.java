package com.e2eq.dats.queries;

import com.e2eq.dats.core.JoinStep;
import com.e2eq.dats.core.TypeFilter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Named join chains loaded from YAML. The default catalog ships as {@value #DEFAULT_RESOURCE}.
 *
 * <pre>
 * version: 1
 * queries:
 *   - id: dataset-parts
 *     steps:
 *       - { as: parent, type: Dataset }
 *       - { as: child, predicate: hasPart, type: Dataset }
 *     select: [parent, child]
 * </pre>
 *
 * A step without {@code type} matches any node; {@code literal: true} matches scalar values.
 * {@code equals} and {@code param} restrict the bound value, {@code optional: true} lets the parameter stay unbound.
 */
public final class QueryCatalog {
    private static final Logger LOG = Logger.getLogger(QueryCatalog.class);

    public static final String DEFAULT_RESOURCE = "/dats-queries.yaml";

    // DTOs mirroring YAML
    public record YQueries(Integer version, List<YQuery> queries) {}
    public record YQuery(String id, String description, List<YStep> steps, List<String> select, List<String> orderBy) {}
    public record YStep(@JsonProperty("as") String label,
                        String from,
                        String predicate,
                        String type,
                        Boolean literal,
                        @JsonProperty("equals") String requiredValue,
                        String param,
                        Boolean optional) {}

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, QueryDefinition> queries;

    private QueryCatalog(Map<String, QueryDefinition> queries) {
        this.queries = Collections.unmodifiableMap(queries);
    }

    public static QueryCatalog loadDefault() throws IOException {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public static QueryCatalog loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = QueryCatalog.class.getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public static QueryCatalog loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * @throws IllegalArgumentException when a query is incomplete or its steps do not form a valid chain
     */
    public static QueryCatalog load(InputStream in) throws IOException {
        YQueries y = MAPPER.readValue(in, YQueries.class);
        Map<String, QueryDefinition> out = new LinkedHashMap<>();
        for (YQuery q : Optional.ofNullable(y.queries()).orElse(List.of())) {
            QueryDefinition def = toDefinition(q);
            if (out.putIfAbsent(def.id(), def) != null) {
                throw new IllegalArgumentException("Duplicate query id '" + def.id() + "'");
            }
        }
        LOG.debugf("Loaded %d queries (catalog version %s)", out.size(), y.version());
        return new QueryCatalog(out);
    }

    public Set<String> ids() {
        return queries.keySet();
    }

    public Optional<QueryDefinition> find(String id) {
        return Optional.ofNullable(queries.get(id));
    }

    /**
     * @throws IllegalArgumentException for an unknown query id
     */
    public QueryDefinition get(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown query '" + id + "'. Known: " + queries.keySet()));
    }

    private static QueryDefinition toDefinition(YQuery q) {
        if (StringUtils.isBlank(q.id())) {
            throw new IllegalArgumentException("Query without id");
        }
        List<YStep> ySteps = Optional.ofNullable(q.steps()).orElse(List.of());
        List<JoinStep> steps = new ArrayList<>(ySteps.size());
        Set<String> optional = new LinkedHashSet<>();
        for (int i = 0; i < ySteps.size(); i++) {
            YStep s = ySteps.get(i);
            steps.add(toStep(q.id(), i, s));
            if (Boolean.TRUE.equals(s.optional())) {
                if (s.param() == null) {
                    throw new IllegalArgumentException("Query '" + q.id() + "' step " + i + " is optional but has no param");
                }
                optional.add(s.param());
            }
        }
        try {
            return new QueryDefinition(q.id(), StringUtils.trimToEmpty(q.description()), steps,
                    q.select(), q.orderBy(), optional);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid query '" + q.id() + "': " + e.getMessage(), e);
        }
    }

    private static JoinStep toStep(String queryId, int index, YStep s) {
        TypeFilter target;
        if (Boolean.TRUE.equals(s.literal())) {
            if (StringUtils.isNotBlank(s.type())) {
                throw new IllegalArgumentException("Query '" + queryId + "' step " + index + " cannot be both literal and typed");
            }
            target = TypeFilter.literal();
        } else if (StringUtils.isNotBlank(s.type())) {
            target = TypeFilter.ofType(s.type().trim());
        } else {
            target = TypeFilter.anyNode();
        }
        return new JoinStep(s.label(), StringUtils.trimToNull(s.from()), StringUtils.trimToNull(s.predicate()),
                target, s.requiredValue(), StringUtils.trimToNull(s.param()));
    }
}
