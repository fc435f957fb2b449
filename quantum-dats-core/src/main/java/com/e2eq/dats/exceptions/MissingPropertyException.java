package com.e2eq.dats.exceptions;

/**
 * Thrown when a node property is read by name and the node does not carry it.
 */
public class MissingPropertyException extends DatsGraphException {
    private static final long serialVersionUID = 1L;

    private final String nodeType;
    private final String identity;
    private final String property;

    public MissingPropertyException(String nodeType, String identity, String property) {
        super(String.format("%s node '%s' has no property '%s'", nodeType, identity, property));
        this.nodeType = nodeType;
        this.identity = identity;
        this.property = property;
    }

    public String getNodeType() {
        return nodeType;
    }

    public String getIdentity() {
        return identity;
    }

    public String getProperty() {
        return property;
    }
}
