package com.e2eq.dats.queries;

import com.e2eq.dats.config.GraphConfigs;
import com.e2eq.dats.core.GraphSerializer;
import com.e2eq.dats.core.Node;
import com.e2eq.dats.core.NodeStore;
import com.e2eq.dats.core.TripleIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * A small GTEx-shaped DATS graph: a top-level dataset with two dbGaP study datasets as parts,
 * variables as dimensions, and an "all subjects" study group whose members may link back to it.
 */
final class GtexFixture {
    static final String GTEX_STUDY = "phs000424.v7.p2";
    static final String OTHER_STUDY = "phs000001.v1.p1";
    static final String ALL_SUBJECTS = "all subjects";

    final NodeStore store;
    final Node root;
    final TripleIndex index;

    private GtexFixture(NodeStore store, Node root) {
        this.store = store;
        this.root = root;
        this.index = TripleIndex.load(new GraphSerializer(store.config()).serialize(root));
    }

    static GtexFixture build(boolean backLinks) {
        NodeStore store = new NodeStore(GraphConfigs.withBackLinks(backLinks));

        List<Node> dims = List.of(
                variable(store, "phv00169064.v7.p2", "AGE", "Age"),
                variable(store, "phv00169063.v7.p2", "SEX", "Sex"),
                variable(store, "phv00169061.v7.p2", "SUBJID", "Subject ID"),
                store.create("Dimension",
                        "name", store.create("Annotation", "value", "DTHHRDY"),
                        "description", "Hardy scale"));

        List<Node> subjects = new ArrayList<>();
        for (String name : List.of("GTEX-111FC", "GTEX-1117F", "GTEX-111CU")) {
            subjects.add(store.create("Material", "name", name, "characteristics", List.of()));
        }
        Node group = store.create("StudyGroup", "name", ALL_SUBJECTS, "members", subjects, "size", subjects.size());
        for (Node s : subjects) {
            store.linkBack(s, "member of study group", group);
        }
        Node study = store.create("Study", "name", "GTEx", "studyGroups", List.of(group));

        Node files = store.create("Dataset", "title", "GTEx v7 RNA-Seq files");
        Node gtex = store.create("Dataset",
                "identifier", identifier(store, GTEX_STUDY),
                "title", "Genotype-Tissue Expression Project (GTEx)",
                "dimensions", dims,
                "producedBy", study,
                "hasPart", List.of(files));
        Node other = store.create("Dataset",
                "identifier", identifier(store, OTHER_STUDY),
                "title", "Other study",
                "dimensions", List.of(variable(store, "phv00000001.v1.p1", "BMI", "Body mass index")));
        Node root = store.create("Dataset", "title", "GTEx v7 data", "hasPart", List.of(gtex, other));
        return new GtexFixture(store, root);
    }

    private static Node identifier(NodeStore store, String accession) {
        return store.create("Identifier", "identifier", accession, "identifierSource", "dbGaP");
    }

    private static Node variable(NodeStore store, String accession, String name, String description) {
        return store.create("Dimension",
                "identifier", identifier(store, accession),
                "name", store.create("Annotation", "value", name),
                "description", description);
    }
}
