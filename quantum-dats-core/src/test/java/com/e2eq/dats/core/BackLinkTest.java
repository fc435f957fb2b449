package com.e2eq.dats.core;

import com.e2eq.dats.config.GraphConfigs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class BackLinkTest {

    private static Node buildStudy(NodeStore store) {
        Node s1 = store.create("Material", "name", "GTEX-1");
        Node s2 = store.create("Material", "name", "GTEX-2");
        Node group = store.create("StudyGroup", "name", "all subjects", "members", List.of(s1, s2));
        store.linkBack(s1, "member of study group", group);
        store.linkBack(s2, "member of study group", group);
        return store.create("Study", "name", "GTEx", "studyGroups", List.of(group));
    }

    @Test
    public void backLinksCreateCycleThroughReferences() {
        NodeStore store = new NodeStore(GraphConfigs.withBackLinks(true));
        Node study = buildStudy(store);

        TripleIndex index = TripleIndex.load(new GraphSerializer().serialize(study));
        assertTrue(index.findCycle().isPresent());

        JoinChain chain = JoinChain.start("subject", "Material")
                .hop("carrier", "characteristics", "Dimension")
                .hop("group", "values", "StudyGroup")
                .from("carrier").literal("label", "name")
                .build();
        JoinResult result = new JoinEngine().execute(
                JoinQuery.builder(chain).select("subject", "group", "label").build(), index);
        assertEquals(2, result.size());
        assertEquals(List.of("member of study group", "member of study group"), result.column("label"));
    }

    @Test
    public void carrierIsDeduplicatedAndAppendedOnce() {
        NodeStore store = new NodeStore(GraphConfigs.withBackLinks(true));
        Node subject = store.create("Material", "name", "GTEX-1");
        Node group = store.create("StudyGroup", "name", "all subjects", "members", List.of(subject));

        Optional<Node> first = store.linkBack(subject, "member of study group", group);
        Optional<Node> second = store.linkBack(subject, "member of study group", group);
        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
        assertEquals("Dimension", first.get().type());
        assertEquals(List.of(group.toReference()), first.get().getList("values"));
        assertEquals(1, subject.getList("characteristics").size());
        assertThrows(IllegalArgumentException.class, () -> store.linkBack(subject, " ", group));
    }

    @Test
    public void disablingBackLinksKeepsDocumentAcyclic() {
        NodeStore store = new NodeStore(GraphConfigs.withBackLinks(false));
        Node study = buildStudy(store);

        assertEquals(2, store.suppressedBackLinks());
        Node group = (Node) study.getList("studyGroups").get(0);
        for (Object member : group.getList("members")) {
            assertFalse(((Node) member).has("characteristics"));
        }
        TripleIndex index = TripleIndex.load(new GraphSerializer().serialize(study));
        assertTrue(index.findCycle().isEmpty());
        assertTrue(index.subjectsOfType("Dimension").isEmpty());
    }

    @Test
    public void customSlotAndCarrierType() {
        NodeStore store = new NodeStore(GraphConfigs.load(java.util.Map.of(
                "quantum.dats.graph.back-link-slot", "extraProperties",
                "quantum.dats.graph.back-link-type", "CategoryValue")));
        Node subject = store.create("Material", "name", "GTEX-1");
        Node group = store.create("StudyGroup", "name", "g");
        Node carrier = store.linkBack(subject, "member of", group).orElseThrow();
        assertEquals(NodeKind.CATEGORY_VALUE, carrier.kind());
        assertEquals(List.of(carrier), subject.getList("extraProperties"));
    }
}
