package com.e2eq.dats.exceptions;

/**
 * Thrown when the structural identity of a node cannot be established or would be ambiguous.
 * <p>
 * Two distinct contents claiming the same explicit identifier, a node with neither an identifier
 * nor any properties, or a node that belongs to a different store all make deduplication
 * unverifiable, so the run is aborted.
 * </p>
 */
public class NodeIdentityException extends DatsGraphException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** An explicit identifier is already bound to a node with a different type or content. */
        CONFLICT,
        /** Neither an explicit identifier nor any property to fingerprint. */
        UNDERIVABLE,
        /** An explicit identifier with no other content; it would serialize exactly like a reference. */
        CONTENTLESS,
        /** The node was created by another store. */
        FOREIGN_NODE
    }

    private final Reason reason;
    private final String nodeType;
    private final String identity;

    public NodeIdentityException(Reason reason, String nodeType, String identity, String message) {
        super(message);
        this.reason = reason;
        this.nodeType = nodeType;
        this.identity = identity;
    }

    public static NodeIdentityException conflict(String identity, String existingType, String attemptedType) {
        String detail = existingType.equals(attemptedType)
                ? "with different content"
                : "as type '" + attemptedType + "' (already bound to type '" + existingType + "')";
        return new NodeIdentityException(Reason.CONFLICT, attemptedType, identity,
                String.format("Explicit identifier '%s' claimed again %s", identity, detail));
    }

    public static NodeIdentityException underivable(String nodeType) {
        return new NodeIdentityException(Reason.UNDERIVABLE, nodeType, null,
                String.format("Cannot derive an identity for %s node: no identifier and no properties", nodeType));
    }

    public static NodeIdentityException contentless(String nodeType, String identity) {
        return new NodeIdentityException(Reason.CONTENTLESS, nodeType, identity,
                String.format("%s node '%s' carries an identifier but no content", nodeType, identity));
    }

    public static NodeIdentityException foreignNode(String nodeType, String identity) {
        return new NodeIdentityException(Reason.FOREIGN_NODE, nodeType, identity,
                String.format("%s node '%s' is not owned by this store", nodeType, identity));
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * The type tag of the node being created.
     */
    public String getNodeType() {
        return nodeType;
    }

    /**
     * The identity involved, or null when none could be derived.
     */
    public String getIdentity() {
        return identity;
    }
}
