package com.e2eq.dats.core;

import com.e2eq.dats.exceptions.MissingPropertyException;

import java.util.*;

/**
 * A typed DATS record with ordered properties. Instances are created and owned by a {@link NodeStore};
 * the identity is fixed at creation time and later mutation (e.g. appended back-links) does not change it.
 *
 * <p>Property values are scalars ({@code String}, {@code Number}, {@code Boolean}), nested {@link Node}s,
 * {@link Reference}s, ordered {@code List}s of those (order is significant) or {@code Set}s (unordered,
 * canonicalized for identity and emitted in canonical order).</p>
 */
public final class Node {
    private final String type;
    private final NodeKind kind;
    private final String identity;
    private final boolean explicitIdentity;
    private final String fingerprint;
    private final LinkedHashMap<String, Object> properties;

    Node(String type, String identity, boolean explicitIdentity, String fingerprint, LinkedHashMap<String, Object> properties) {
        this.type = type;
        this.kind = NodeKind.fromType(type);
        this.identity = identity;
        this.explicitIdentity = explicitIdentity;
        this.fingerprint = fingerprint;
        this.properties = properties;
    }

    public String type() { return type; }
    public NodeKind kind() { return kind; }
    public String identity() { return identity; }
    public boolean hasExplicitIdentity() { return explicitIdentity; }

    /**
     * Content fingerprint computed when the node was created; used to detect explicit-identifier conflicts.
     */
    String fingerprint() { return fingerprint; }

    public Reference toReference() {
        return new Reference(identity, type);
    }

    public boolean has(String name) {
        return properties.containsKey(name);
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * @throws MissingPropertyException if the node has no such property
     */
    public Object get(String name) {
        Object value = properties.get(name);
        if (value == null) {
            throw new MissingPropertyException(type, identity, name);
        }
        return value;
    }

    public String getString(String name) {
        Object value = get(name);
        if (!(value instanceof String s)) {
            throw new IllegalStateException(String.format("Property '%s' of %s node '%s' is not a string", name, type, identity));
        }
        return s;
    }

    public Node getNode(String name) {
        Object value = get(name);
        if (!(value instanceof Node n)) {
            throw new IllegalStateException(String.format("Property '%s' of %s node '%s' is not a node", name, type, identity));
        }
        return n;
    }

    /**
     * Live view of a list-valued property; appending through {@link #append} keeps it mutable.
     */
    public List<Object> getList(String name) {
        Object value = get(name);
        if (!(value instanceof List<?>)) {
            throw new IllegalStateException(String.format("Property '%s' of %s node '%s' is not a list", name, type, identity));
        }
        return Collections.unmodifiableList(asList(value));
    }

    /**
     * Replaces (or adds at the end) a property value. Does not affect the node's identity.
     */
    public Node set(String name, Object value) {
        properties.put(requireName(name), copyValue(name, value));
        return this;
    }

    /**
     * Appends a value to a list-valued property, creating the list when absent.
     */
    public Node append(String name, Object value) {
        requireName(name);
        checkElement(name, value);
        Object current = properties.get(name);
        if (current == null) {
            List<Object> list = new ArrayList<>();
            list.add(value);
            properties.put(name, list);
        } else if (current instanceof List<?>) {
            asList(current).add(value);
        } else {
            throw new IllegalStateException(String.format("Cannot append to non-list property '%s' of %s node '%s'", name, type, identity));
        }
        return this;
    }

    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return (List<Object>) value;
    }

    static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name must be non-empty");
        }
        if (name.equals(GraphSerializer.TYPE_KEY) || name.equals(GraphSerializer.ID_KEY)) {
            throw new IllegalArgumentException("Property name '" + name + "' is reserved");
        }
        return name;
    }

    /**
     * Validates a property value and copies collections so the node owns its own mutable containers.
     */
    static Object copyValue(String name, Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                checkElement(name, element);
                copy.add(element);
            }
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>(set.size());
            for (Object element : set) {
                checkElement(name, element);
                copy.add(element);
            }
            return copy;
        }
        checkElement(name, value);
        return value;
    }

    private static void checkElement(String name, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Null value for property '" + name + "'");
        }
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean
                || value instanceof Node || value instanceof Reference)) {
            throw new IllegalArgumentException(String.format("Unsupported value of type %s for property '%s'",
                    value.getClass().getName(), name));
        }
    }

    @Override
    public String toString() {
        return type + "[" + identity + "]";
    }
}
