package com.e2eq.dats.exceptions;

/**
 * Thrown when a serialized graph document is structurally inconsistent: a missing type tag,
 * a reference with no full emission anywhere in the document, a reference whose type disagrees with that
 * emission, or an identity emitted in full twice.
 * The triple index refuses to build from such a document, and the serializer refuses to produce one.
 */
public class MalformedGraphException extends DatsGraphException {
    private static final long serialVersionUID = 1L;

    private final String path;
    private final String identity;

    public MalformedGraphException(String message, String path, String identity) {
        super(path != null ? message + " (at " + path + ")" : message);
        this.path = path;
        this.identity = identity;
    }

    public static MalformedGraphException missingType(String path) {
        return new MalformedGraphException("Object has no @type tag", path, null);
    }

    public static MalformedGraphException invalidIdentifier(String path) {
        return new MalformedGraphException("@id must be a non-blank string", path, null);
    }

    public static MalformedGraphException danglingReference(String identity, String path) {
        return new MalformedGraphException(
                "Reference to '" + identity + "' has no full emission in the document", path, identity);
    }

    public static MalformedGraphException duplicateDefinition(String identity, String path) {
        return new MalformedGraphException(
                "Identity '" + identity + "' is emitted in full more than once", path, identity);
    }

    public static MalformedGraphException typeMismatch(String identity, String referencedAs, String definedAs, String path) {
        return new MalformedGraphException(
                String.format("Reference to '%s' declares type '%s' but it is defined as '%s'", identity, referencedAs, definedAs),
                path, identity);
    }

    /**
     * JSON pointer of the offending object, when known.
     */
    public String getPath() {
        return path;
    }

    public String getIdentity() {
        return identity;
    }
}
