package com.e2eq.dats.core;

import com.e2eq.dats.config.GraphConfig;
import com.e2eq.dats.config.GraphConfigs;
import com.e2eq.dats.exceptions.NodeIdentityException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Registry of canonical nodes for one conversion run. Every node is created through
 * {@link #create(String, Map)}, which computes its structural identity and returns the already
 * registered instance when one exists (the first writer wins).
 *
 * <p>A store is created by the orchestrating caller, passed to every collaborator that builds nodes
 * and discarded when the run ends. It is not thread-safe.</p>
 */
public class NodeStore {
    private static final Logger LOG = Logger.getLogger(NodeStore.class);

    private final GraphConfig config;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private int cacheHits;
    private int suppressedBackLinks;
    private boolean suppressionLogged;

    public NodeStore() {
        this(GraphConfigs.defaults());
    }

    public NodeStore(GraphConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GraphConfig config() {
        return config;
    }

    /**
     * Convenience form taking alternating property names and values, e.g.
     * {@code create("Material", "name", "GTEX-1", "roles", List.of(role))}.
     */
    public Node create(String type, Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating property names and values for type " + type);
        }
        LinkedHashMap<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("Property name at position " + i + " is not a string");
            }
            properties.put(name, namesAndValues[i + 1]);
        }
        return create(type, properties);
    }

    /**
     * Constructs or retrieves the canonical node for {@code type} and {@code properties}.
     *
     * @throws NodeIdentityException when the identity cannot be derived, when an explicit identifier is
     *                               claimed by different content, or when a nested node belongs to another store
     */
    public Node create(String type, Map<String, ?> properties) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Node type must be non-empty");
        }
        Objects.requireNonNull(properties, "properties");

        String idProperty = config.identifierProperty();
        String explicitId = null;
        LinkedHashMap<String, Object> content = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : properties.entrySet()) {
            if (e.getKey().equals(idProperty)) {
                explicitId = explicitIdentifier(type, e.getValue());
                continue;
            }
            Node.requireName(e.getKey());
            Object value = Node.copyValue(e.getKey(), e.getValue());
            checkOwnership(type, value);
            content.put(e.getKey(), value);
        }

        if (explicitId == null && content.isEmpty()) {
            throw NodeIdentityException.underivable(type);
        }
        if (explicitId != null && content.isEmpty()) {
            throw NodeIdentityException.contentless(type, explicitId);
        }

        String fingerprint = NodeHasher.fingerprint(type, content, null);
        String identity = explicitId != null ? explicitId : NodeHasher.derivedIdentity(type, fingerprint);

        Node existing = nodes.get(identity);
        if (existing != null) {
            if (explicitId != null && (!existing.type().equals(type) || !existing.fingerprint().equals(fingerprint))) {
                throw NodeIdentityException.conflict(identity, existing.type(), type);
            }
            cacheHits++;
            LOG.debugf("Reusing canonical %s node %s", type, identity);
            return existing;
        }

        Node node = new Node(type, identity, explicitId != null, fingerprint, content);
        nodes.put(identity, node);
        return node;
    }

    /**
     * @return a reference to {@code node}'s identity, usable anywhere a property value is expected
     */
    public Reference reference(Node node) {
        requireOwned(node);
        return node.toReference();
    }

    /**
     * Adds a back-link from {@code source} to {@code target}: a carrier node of the configured back-link type
     * holding {@code name = edgeLabel} and a reference to {@code target} is appended to the source's
     * back-link slot. Appending the same carrier twice to one source has no effect.
     *
     * @return the carrier node, or empty when back-links are disabled
     */
    public Optional<Node> linkBack(Node source, String edgeLabel, Node target) {
        if (!config.allowBackLinks()) {
            suppressedBackLinks++;
            if (!suppressionLogged) {
                suppressionLogged = true;
                LOG.warnf("Back-link creation is disabled (quantum.dats.graph.allow-back-links=false); "
                        + "skipping '%s' from %s and all further back-links of this run", edgeLabel, source);
            }
            return Optional.empty();
        }
        if (edgeLabel == null || edgeLabel.isBlank()) {
            throw new IllegalArgumentException("Back-link label must be non-empty");
        }
        requireOwned(source);
        requireOwned(target);

        LinkedHashMap<String, Object> carrierProps = new LinkedHashMap<>();
        carrierProps.put("name", edgeLabel);
        carrierProps.put("values", List.of(target.toReference()));
        Node carrier = create(config.backLinkType(), carrierProps);

        String slot = config.backLinkSlot();
        boolean present = source.find(slot)
                .filter(v -> v instanceof List<?>)
                .map(v -> ((List<?>) v).contains(carrier))
                .orElse(false);
        if (!present) {
            source.append(slot, carrier);
        }
        return Optional.of(carrier);
    }

    public boolean contains(String identity) {
        return nodes.containsKey(identity);
    }

    public Optional<Node> get(String identity) {
        return Optional.ofNullable(nodes.get(identity));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Number of {@code create} calls that returned an already registered node.
     */
    public int cacheHits() {
        return cacheHits;
    }

    public int suppressedBackLinks() {
        return suppressedBackLinks;
    }

    boolean owns(Node node) {
        return nodes.get(node.identity()) == node;
    }

    private String explicitIdentifier(String type, Object value) {
        if (!(value instanceof String id) || id.isBlank()) {
            throw new IllegalArgumentException(String.format("Explicit identifier '%s' of %s node must be a non-blank string",
                    config.identifierProperty(), type));
        }
        return id;
    }

    private void requireOwned(Node node) {
        Objects.requireNonNull(node, "node");
        if (!owns(node)) {
            throw NodeIdentityException.foreignNode(node.type(), node.identity());
        }
    }

    private void checkOwnership(String type, Object value) {
        if (value instanceof Collection<?> values) {
            for (Object v : values) checkOwnership(type, v);
        } else if (value instanceof Node nested && !owns(nested)) {
            throw NodeIdentityException.foreignNode(nested.type(), nested.identity());
        }
    }
}
