package com.e2eq.dats.core;

import com.e2eq.dats.config.GraphConfigs;
import com.e2eq.dats.exceptions.MalformedGraphException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GraphSerializerTest {

    @Test
    public void sharedNodeIsEmittedInFullOnce() {
        NodeStore store = new NodeStore();
        Node donor = store.create("Annotation", "value", "donor");
        Node s1 = store.create("Material", "name", "GTEX-1", "roles", List.of(donor));
        Node s2 = store.create("Material", "name", "GTEX-2", "roles", List.of(donor));
        Node group = store.create("StudyGroup", "name", "all subjects", "members", List.of(s1, s2, s1));

        GraphSerializer serializer = new GraphSerializer();
        ObjectNode doc = serializer.serialize(group);

        Map<String, Integer> fullEmissions = new HashMap<>();
        countFullEmissions(doc, fullEmissions);
        for (Map.Entry<String, Integer> e : fullEmissions.entrySet()) {
            assertEquals(1, e.getValue(), "identity emitted in full more than once: " + e.getKey());
        }
        assertEquals(4, fullEmissions.size());

        JsonNode members = doc.get("members");
        assertEquals(3, members.size());
        assertEquals("GTEX-1", members.get(0).get("name").asText());
        assertEquals("GTEX-2", members.get(1).get("name").asText());
        // third entry repeats s1 and must be a reference
        assertEquals(2, members.get(2).size());
        assertEquals(s1.identity(), members.get(2).get("@id").asText());
        assertEquals("Material", members.get(2).get("@type").asText());
        // donor annotation is a reference inside the second subject
        assertEquals(2, members.get(1).get("roles").get(0).size());

        assertEquals(new GraphSerializer.Statistics(4, 2), serializer.lastStatistics());
    }

    @Test
    public void fullEmissionLeadsWithTypeAndIdentity() {
        NodeStore store = new NodeStore();
        Node ds = store.create("Dataset", "@id", "phs000424.v7.p2", "title", "GTEx", "version", 7, "public", true);
        ObjectNode doc = new GraphSerializer().serialize(ds);

        List<String> keys = new ArrayList<>();
        doc.fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("@type", "@id", "title", "version", "public"), keys);
        assertEquals(7, doc.get("version").asInt());
        assertTrue(doc.get("public").asBoolean());
    }

    @Test
    public void listOrderIsPreservedAndSetsAreCanonical() {
        NodeStore store = new NodeStore();
        Node dist = store.create("DatasetDistribution",
                "files", List.of("z.vcf", "a.vcf", "m.vcf"),
                "formats", new LinkedHashSet<>(List.of("VCF", "BAM")));
        ObjectNode doc = new GraphSerializer().serialize(dist);

        assertEquals("z.vcf", doc.get("files").get(0).asText());
        assertEquals("a.vcf", doc.get("files").get(1).asText());
        assertEquals("m.vcf", doc.get("files").get(2).asText());
        assertEquals("BAM", doc.get("formats").get(0).asText());
        assertEquals("VCF", doc.get("formats").get(1).asText());
    }

    @Test
    public void referenceWithoutFullEmissionIsRejected() {
        NodeStore store = new NodeStore();
        Node group = store.create("StudyGroup", "name", "all subjects");
        Node subject = store.create("Material", "name", "GTEX-1", "memberOf", store.reference(group));

        MalformedGraphException ex = assertThrows(MalformedGraphException.class,
                () -> new GraphSerializer().serialize(subject));
        assertEquals(group.identity(), ex.getIdentity());
        assertEquals("/memberOf", ex.getPath());
    }

    @Test
    public void referenceResolvedByLaterFullEmission() {
        NodeStore store = new NodeStore();
        Node group = store.create("StudyGroup", "name", "all subjects");
        Node subject = store.create("Material", "name", "GTEX-1", "memberOf", store.reference(group));
        Node study = store.create("Study", "name", "GTEx", "subjects", List.of(subject), "studyGroups", List.of(group));

        ObjectNode doc = new GraphSerializer().serialize(study);
        assertEquals("all subjects", doc.get("studyGroups").get(0).get("name").asText());
        TripleIndex index = TripleIndex.load(doc);
        assertEquals(List.of(group.identity()),
                index.outgoing(subject.identity(), "memberOf").stream().map(Triple::object).toList());
    }

    @Test
    public void referenceWithWrongTypeIsRejected() {
        NodeStore store = new NodeStore();
        Node group = store.create("StudyGroup", "name", "all subjects");
        Node subject = store.create("Material", "name", "GTEX-1", "memberOf", new Reference(group.identity(), "Person"));
        Node study = store.create("Study", "name", "GTEx", "subjects", List.of(subject), "studyGroups", List.of(group));

        MalformedGraphException ex = assertThrows(MalformedGraphException.class,
                () -> new GraphSerializer().serialize(study));
        assertEquals(group.identity(), ex.getIdentity());
        assertEquals("/subjects/0/memberOf", ex.getPath());
        assertTrue(ex.getMessage().contains("'Person'"));
        assertTrue(ex.getMessage().contains("'StudyGroup'"));
    }

    @Test
    public void writeHonoursPrettyPrint() throws Exception {
        NodeStore store = new NodeStore();
        Node n = store.create("Material", "name", "GTEX-1");

        String pretty = new GraphSerializer(GraphConfigs.load(Map.of("quantum.dats.graph.pretty-print", "true"))).toJson(n);
        assertTrue(pretty.contains("\n"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new GraphSerializer(GraphConfigs.load(Map.of("quantum.dats.graph.pretty-print", "false"))).write(n, out);
        String compact = out.toString(StandardCharsets.UTF_8);
        assertFalse(compact.contains("\n"));
        assertTrue(compact.startsWith("{\"@type\":\"Material\",\"@id\":\"#Material-"));
    }

    private static void countFullEmissions(JsonNode node, Map<String, Integer> counts) {
        if (node.isObject()) {
            boolean reference = node.size() == 2 && node.has("@id") && node.has("@type");
            if (!reference && node.has("@id")) {
                counts.merge(node.get("@id").asText(), 1, Integer::sum);
            }
            node.elements().forEachRemaining(child -> countFullEmissions(child, counts));
        } else if (node.isArray()) {
            node.elements().forEachRemaining(child -> countFullEmissions(child, counts));
        }
    }
}
