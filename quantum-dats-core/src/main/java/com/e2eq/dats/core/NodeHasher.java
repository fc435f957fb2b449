package com.e2eq.dats.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Computes structural fingerprints of node content by canonicalizing to sorted JSON.
 * Nested nodes and references contribute only their identity, lists keep their order and
 * sets are sorted by the canonical JSON of their elements, so the result does not depend on
 * the iteration order of unordered collections.
 */
public final class NodeHasher {
    private NodeHasher() {}

    static final int DERIVED_HEX_LENGTH = 32;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    /**
     * Full SHA-256 hex digest of the canonical form of {@code type} plus {@code properties}.
     * The property named {@code skipProperty} (the explicit identifier) is left out, may be null.
     */
    public static String fingerprint(String type, Map<String, Object> properties, String skipProperty) {
        Map<String, Object> canonical = new TreeMap<>();
        for (Map.Entry<String, Object> e : properties.entrySet()) {
            if (e.getKey().equals(skipProperty)) continue;
            canonical.put(e.getKey(), canonicalize(e.getValue()));
        }
        canonical.put("@type", type);
        return sha256Hex(toJson(canonical));
    }

    /**
     * Derived identity for a node without an explicit identifier: {@code #<type>-<first 32 hex chars>}.
     */
    public static String derivedIdentity(String type, String fingerprint) {
        return "#" + type + "-" + fingerprint.substring(0, DERIVED_HEX_LENGTH);
    }

    static Object canonicalize(Object value) {
        if (value instanceof Node n) {
            return Map.of("@id", n.identity());
        }
        if (value instanceof Reference r) {
            return Map.of("@id", r.identity());
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object v : list) out.add(canonicalize(v));
            return out;
        }
        if (value instanceof Set<?> set) {
            List<String> encoded = new ArrayList<>(set.size());
            for (Object v : set) encoded.add(toJson(canonicalize(v)));
            Collections.sort(encoded);
            List<Object> out = new ArrayList<>(encoded.size());
            for (String json : encoded) out.add(readTree(json));
            return out;
        }
        return value;
    }

    /**
     * Orders set elements for emission: sorted by the canonical JSON of each element.
     */
    public static List<Object> canonicalOrder(Set<?> set) {
        List<Object> ordered = new ArrayList<>(set);
        ordered.sort(Comparator.comparing(v -> toJson(canonicalize(v))));
        return ordered;
    }

    static String toJson(Object canonical) {
        try {
            return MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize node content", e);
        }
    }

    private static Object readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize node content", e);
        }
    }

    private static String sha256Hex(String json) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(json.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
