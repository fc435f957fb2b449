package com.e2eq.dats.core;

import com.e2eq.dats.config.GraphConfig;
import com.e2eq.dats.config.GraphConfigs;
import com.e2eq.dats.exceptions.DatsGraphException;
import com.e2eq.dats.exceptions.MalformedGraphException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.util.*;

/**
 * Builds the nested JSON document for a root node.
 *
 * <p>The walk is depth-first in property order. The first occurrence of every identity is emitted in full
 * ({@code @type}, {@code @id}, then the properties); every later occurrence, and every explicit
 * {@link Reference}, is emitted as {@code {"@type", "@id"}} only. A reference whose identity never receives
 * a full emission in the same document, or whose declared type differs from that emission's type, is
 * rejected.</p>
 */
public class GraphSerializer {
    private static final Logger LOG = Logger.getLogger(GraphSerializer.class);

    public static final String TYPE_KEY = "@type";
    public static final String ID_KEY = "@id";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GraphConfig config;
    private Statistics lastStatistics = new Statistics(0, 0);

    public record Statistics(int fullEmissions, int references) {}

    public GraphSerializer() {
        this(GraphConfigs.defaults());
    }

    public GraphSerializer(GraphConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ObjectNode serialize(Node root) {
        Objects.requireNonNull(root, "root");
        Walk walk = new Walk();
        ObjectNode doc = walk.emit(root, "");
        walk.verifyReferences();
        lastStatistics = new Statistics(walk.emitted.size(), walk.references);
        LOG.infof("Serialized %s: %d full emissions, %d references", root, walk.emitted.size(), walk.references);
        return doc;
    }

    public String toJson(Node root) {
        try {
            return writer().writeValueAsString(serialize(root));
        } catch (JsonProcessingException e) {
            throw new DatsGraphException("Failed to write graph document for " + root, e);
        }
    }

    public void write(Node root, OutputStream out) throws IOException {
        writer().writeValue(out, serialize(root));
    }

    /**
     * Counts of the most recent {@link #serialize} call.
     */
    public Statistics lastStatistics() {
        return lastStatistics;
    }

    private ObjectWriter writer() {
        return config.prettyPrint() ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();
    }

    private static final class Walk {
        // identity -> type of its full emission
        private final Map<String, String> emitted = new HashMap<>();
        private final List<EmittedReference> referenced = new ArrayList<>();
        private int references;

        private record EmittedReference(Reference reference, String path) {}

        ObjectNode emit(Node node, String path) {
            if (emitted.putIfAbsent(node.identity(), node.type()) != null) {
                return reference(node.toReference(), path);
            }
            ObjectNode obj = MAPPER.createObjectNode();
            obj.put(TYPE_KEY, node.type());
            obj.put(ID_KEY, node.identity());
            for (Map.Entry<String, Object> e : node.properties().entrySet()) {
                String childPath = path + "/" + escape(e.getKey());
                obj.set(e.getKey(), value(e.getValue(), childPath));
            }
            return obj;
        }

        ObjectNode reference(Reference ref, String path) {
            references++;
            referenced.add(new EmittedReference(ref, path));
            ObjectNode obj = MAPPER.createObjectNode();
            obj.put(TYPE_KEY, ref.type());
            obj.put(ID_KEY, ref.identity());
            return obj;
        }

        void verifyReferences() {
            for (EmittedReference r : referenced) {
                String definedAs = emitted.get(r.reference().identity());
                if (definedAs == null) {
                    throw MalformedGraphException.danglingReference(r.reference().identity(), r.path());
                }
                if (!definedAs.equals(r.reference().type())) {
                    throw MalformedGraphException.typeMismatch(r.reference().identity(), r.reference().type(), definedAs, r.path());
                }
            }
        }

        JsonNode value(Object value, String path) {
            if (value instanceof Node n) {
                return emit(n, path);
            }
            if (value instanceof Reference r) {
                return reference(r, path);
            }
            if (value instanceof List<?> list) {
                return array(list, path);
            }
            if (value instanceof Set<?> set) {
                return array(NodeHasher.canonicalOrder(set), path);
            }
            return MAPPER.valueToTree(value);
        }

        private ArrayNode array(List<?> values, String path) {
            ArrayNode arr = MAPPER.createArrayNode();
            int i = 0;
            for (Object v : values) {
                arr.add(value(v, path + "/" + i++));
            }
            return arr;
        }

        private static String escape(String key) {
            return key.replace("~", "~0").replace("/", "~1");
        }
    }
}
