package com.e2eq.dats.queries;

import com.e2eq.dats.core.JoinEngine;
import com.e2eq.dats.core.JoinResult;
import com.e2eq.dats.core.Triple;
import com.e2eq.dats.core.TripleSource;
import com.e2eq.dats.queries.model.DatasetVariable;
import com.e2eq.dats.queries.model.SecondLevelDataset;
import com.e2eq.dats.queries.model.StudyGroupMember;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Canned DATS metadata queries, run through the {@link JoinEngine} with chains from the {@link QueryCatalog}.
 */
@ApplicationScoped
public class DatsQueries {
    private static final Logger LOG = Logger.getLogger(DatsQueries.class);

    public static final String DATASET_VARIABLES = "dataset-variables";
    public static final String DATASET_PARTS = "dataset-parts";
    public static final String STUDY_GROUP_MEMBERS = "study-group-members";

    private static final String IDENTIFIER = "identifier";
    private static final String TITLE = "title";

    private final JoinEngine engine;
    private final QueryCatalog catalog;

    public DatsQueries() {
        this(new JoinEngine(), defaultCatalog());
    }

    public DatsQueries(JoinEngine engine, QueryCatalog catalog) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Variables of every dataset with a study accession, or of the dataset whose accession is {@code datasetId}.
     * Datasets without an identifier and variables without an identifier are skipped.
     *
     * @param datasetId dbGaP study accession to restrict to, may be null
     */
    public List<DatasetVariable> listDatasetVariables(TripleSource source, String datasetId) {
        Map<String, String> params = datasetId == null ? Map.of() : Map.of("datasetId", datasetId);
        JoinResult result = run(DATASET_VARIABLES, source, params);
        List<DatasetVariable> out = new ArrayList<>(result.size());
        for (List<String> row : result.rows()) {
            out.add(new DatasetVariable(row.get(0), row.get(1), row.get(2), row.get(3)));
        }
        return out;
    }

    /**
     * Datasets that are direct parts of a root dataset (one that is not itself a part of another dataset).
     * Datasets are reported by accession where they carry an identifier, otherwise by identity.
     */
    public List<SecondLevelDataset> listSecondLevelDatasets(TripleSource source) {
        JoinResult parts = run(DATASET_PARTS, source, Map.of());
        Set<String> nested = new HashSet<>(parts.column("child"));
        List<SecondLevelDataset> out = new ArrayList<>();
        for (List<String> row : parts.rows()) {
            String parent = row.get(0);
            String child = row.get(1);
            if (nested.contains(parent)) continue;
            out.add(new SecondLevelDataset(accessionOf(source, parent), accessionOf(source, child),
                    firstLiteral(source, child, TITLE).orElse("")));
        }
        out.sort(Comparator.comparing(SecondLevelDataset::getParentId).thenComparing(SecondLevelDataset::getDatasetId));
        return out;
    }

    public List<StudyGroupMember> listStudyGroupMembers(TripleSource source, String datasetId, String groupName) {
        if (StringUtils.isAnyBlank(datasetId, groupName)) {
            throw new IllegalArgumentException("Both a dataset accession and a study group name are required");
        }
        JoinResult result = run(STUDY_GROUP_MEMBERS, source, Map.of("datasetId", datasetId, "groupName", groupName));
        List<StudyGroupMember> out = new ArrayList<>(result.size());
        for (List<String> row : result.rows()) {
            out.add(new StudyGroupMember(row.get(0), row.get(1), row.get(2)));
        }
        return out;
    }

    JoinResult run(String queryId, TripleSource source, Map<String, String> params) {
        JoinResult result = engine.execute(catalog.get(queryId).toQuery(params), source);
        LOG.debugf("Query %s %s: %d rows", queryId, params, result.size());
        return result;
    }

    private static String accessionOf(TripleSource source, String node) {
        for (Triple t : source.outgoing(node, IDENTIFIER)) {
            if (t.literal()) continue;
            Optional<String> acc = firstLiteral(source, t.object(), IDENTIFIER);
            if (acc.isPresent()) return acc.get();
        }
        return node;
    }

    private static Optional<String> firstLiteral(TripleSource source, String node, String predicate) {
        return source.outgoing(node, predicate).stream()
                .filter(Triple::literal)
                .map(Triple::object)
                .findFirst();
    }

    private static QueryCatalog defaultCatalog() {
        try {
            return QueryCatalog.loadDefault();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + QueryCatalog.DEFAULT_RESOURCE, e);
        }
    }
}
