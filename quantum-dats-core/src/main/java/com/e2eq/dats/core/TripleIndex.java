package com.e2eq.dats.core;

import com.e2eq.dats.exceptions.DatsGraphException;
import com.e2eq.dats.exceptions.MalformedGraphException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Immutable triple snapshot of a serialized graph document.
 *
 * <p>Every object of the document is either a full emission (it carries properties besides {@code @id} and
 * {@code @type}) or a reference (only {@code @id} and {@code @type}). Both contribute the same
 * {@code (subject, predicate, identity)} edge to their parent, so queries cannot tell them apart.
 * Objects without {@code @id} receive blank identities {@code _:b<n>} in document order.</p>
 *
 * <p>Loading fails with {@link MalformedGraphException} on a missing type tag, a non-textual identifier,
 * a reference with no full emission, an identity emitted in full twice, or a reference whose declared type
 * disagrees with the definition.</p>
 */
public final class TripleIndex implements TripleSource {
    private static final Logger LOG = Logger.getLogger(TripleIndex.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String BLANK_PREFIX = "_:b";

    private final ImmutableList<Triple> triples;
    private final ImmutableListMultimap<String, Triple> bySubject;
    private final ImmutableListMultimap<SubjectPredicate, Triple> bySubjectPredicate;
    private final ImmutableListMultimap<String, String> byType;
    private final ImmutableMap<String, String> typeById;

    private record SubjectPredicate(String subject, String predicate) {}

    private TripleIndex(List<Triple> triples, Map<String, String> typeById) {
        this.triples = ImmutableList.copyOf(triples);
        ImmutableListMultimap.Builder<String, Triple> s = ImmutableListMultimap.builder();
        ImmutableListMultimap.Builder<SubjectPredicate, Triple> sp = ImmutableListMultimap.builder();
        for (Triple t : triples) {
            s.put(t.subject(), t);
            sp.put(new SubjectPredicate(t.subject(), t.predicate()), t);
        }
        ImmutableListMultimap.Builder<String, String> types = ImmutableListMultimap.builder();
        typeById.forEach((id, type) -> types.put(type, id));
        this.bySubject = s.build();
        this.bySubjectPredicate = sp.build();
        this.byType = types.build();
        this.typeById = ImmutableMap.copyOf(typeById);
    }

    public static TripleIndex load(String json) {
        try {
            return load(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new DatsGraphException("Graph document is not valid JSON", e);
        }
    }

    /**
     * @throws DatsGraphException when the stream does not hold valid JSON
     * @throws IOException        when the stream cannot be read
     */
    public static TripleIndex load(InputStream in) throws IOException {
        JsonNode document;
        try {
            document = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new DatsGraphException("Graph document is not valid JSON", e);
        }
        return load(document);
    }

    public static TripleIndex load(JsonNode document) {
        Objects.requireNonNull(document, "document");
        Loader loader = new Loader();
        if (document.isObject()) {
            loader.visit(document, "");
        } else if (document.isArray()) {
            for (int i = 0; i < document.size(); i++) {
                JsonNode element = document.get(i);
                if (!element.isObject()) {
                    throw new MalformedGraphException("Document array elements must be objects", "/" + i, null);
                }
                loader.visit(element, "/" + i);
            }
        } else {
            throw new MalformedGraphException("Document root must be an object or an array of objects", "", null);
        }
        loader.verifyReferences();
        TripleIndex index = new TripleIndex(loader.triples, loader.definitions);
        LOG.infof("Triple index loaded: %d subjects, %d triples, %d references resolved",
                index.typeById.size(), index.triples.size(), loader.references.size());
        return index;
    }

    @Override
    public List<Triple> outgoing(String subject) {
        return bySubject.get(subject);
    }

    @Override
    public List<Triple> outgoing(String subject, String predicate) {
        return bySubjectPredicate.get(new SubjectPredicate(subject, predicate));
    }

    @Override
    public List<String> subjectsOfType(String type) {
        return byType.get(type);
    }

    @Override
    public Optional<String> typeOf(String identity) {
        return Optional.ofNullable(typeById.get(identity));
    }

    @Override
    public Set<String> subjects() {
        return typeById.keySet();
    }

    public List<Triple> triples() {
        return triples;
    }

    public int size() {
        return triples.size();
    }

    /**
     * Looks for a cycle among node-to-node edges (literal and type triples are ignored).
     *
     * @return the identities along one cycle, first element repeated at the end, or empty when the graph is acyclic
     */
    public Optional<List<String>> findCycle() {
        // 1 = on the current path, 2 = finished
        Map<String, Integer> state = new HashMap<>();
        for (String start : typeById.keySet()) {
            if (state.containsKey(start)) continue;
            List<String> cycle = walkFrom(start, state);
            if (cycle != null) return Optional.of(cycle);
        }
        return Optional.empty();
    }

    private List<String> walkFrom(String start, Map<String, Integer> state) {
        Deque<Frame> stack = new ArrayDeque<>();
        state.put(start, 1);
        stack.push(new Frame(start, bySubject.get(start).iterator()));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.edges().hasNext()) {
                state.put(top.node(), 2);
                stack.pop();
                continue;
            }
            Triple t = top.edges().next();
            if (t.literal()) continue;
            Integer s = state.get(t.object());
            if (s == null) {
                state.put(t.object(), 1);
                stack.push(new Frame(t.object(), bySubject.get(t.object()).iterator()));
            } else if (s == 1) {
                List<String> cycle = new ArrayList<>();
                Iterator<Frame> path = stack.descendingIterator();
                boolean inCycle = false;
                while (path.hasNext()) {
                    String p = path.next().node();
                    if (p.equals(t.object())) inCycle = true;
                    if (inCycle) cycle.add(p);
                }
                cycle.add(t.object());
                return cycle;
            }
        }
        return null;
    }

    private record Frame(String node, Iterator<Triple> edges) {}

    private static final class Loader {
        private final List<Triple> triples = new ArrayList<>();
        // identity -> declared type of its full emission
        private final Map<String, String> definitions = new LinkedHashMap<>();
        private final List<PendingReference> references = new ArrayList<>();
        private int blankCounter;

        private record PendingReference(String identity, String type, String path) {}

        /**
         * @return the identity of the visited object
         */
        String visit(JsonNode obj, String path) {
            String type = textOf(obj, GraphSerializer.TYPE_KEY);
            if (type == null) {
                throw MalformedGraphException.missingType(path);
            }
            JsonNode idNode = obj.get(GraphSerializer.ID_KEY);
            String identity = null;
            if (idNode != null) {
                if (!idNode.isTextual() || idNode.asText().isBlank()) {
                    throw MalformedGraphException.invalidIdentifier(path);
                }
                identity = idNode.asText();
            }

            if (identity != null && isReference(obj)) {
                references.add(new PendingReference(identity, type, path));
                return identity;
            }

            if (identity == null) {
                identity = BLANK_PREFIX + blankCounter++;
            }
            if (definitions.putIfAbsent(identity, type) != null) {
                throw MalformedGraphException.duplicateDefinition(identity, path);
            }
            triples.add(Triple.literal(identity, Triple.TYPE_PREDICATE, type));

            Iterator<Map.Entry<String, JsonNode>> fields = obj.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                if (key.startsWith("@")) continue;
                addValue(identity, key, field.getValue(), path + "/" + escape(key));
            }
            return identity;
        }

        private void addValue(String subject, String predicate, JsonNode value, String path) {
            if (value == null || value.isNull() || value.isMissingNode()) {
                return;
            }
            if (value.isObject()) {
                triples.add(Triple.node(subject, predicate, visit(value, path)));
            } else if (value.isArray()) {
                for (int i = 0; i < value.size(); i++) {
                    addValue(subject, predicate, value.get(i), path + "/" + i);
                }
            } else {
                triples.add(Triple.literal(subject, predicate, value.asText()));
            }
        }

        void verifyReferences() {
            for (PendingReference ref : references) {
                String definedAs = definitions.get(ref.identity());
                if (definedAs == null) {
                    throw MalformedGraphException.danglingReference(ref.identity(), ref.path());
                }
                if (!definedAs.equals(ref.type())) {
                    throw MalformedGraphException.typeMismatch(ref.identity(), ref.type(), definedAs, ref.path());
                }
            }
        }

        private static boolean isReference(JsonNode obj) {
            Iterator<String> names = obj.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (!name.equals(GraphSerializer.ID_KEY) && !name.equals(GraphSerializer.TYPE_KEY)) {
                    return false;
                }
            }
            return true;
        }

        private static String textOf(JsonNode obj, String key) {
            JsonNode n = obj.get(key);
            if (n == null || !n.isTextual() || n.asText().isBlank()) return null;
            return n.asText();
        }

        private static String escape(String key) {
            return key.replace("~", "~0").replace("/", "~1");
        }
    }
}
