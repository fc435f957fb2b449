package com.e2eq.dats.core;

import java.util.Objects;

/**
 * What a join step accepts as the object of a matched triple.
 */
public record TypeFilter(Kind kind, String type) {

    public enum Kind {
        /** A node whose declared type equals {@link #type()}. */
        NODE_TYPE,
        /** Any node, regardless of type. */
        ANY_NODE,
        /** A scalar value. */
        LITERAL
    }

    public TypeFilter {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.NODE_TYPE && (type == null || type.isBlank())) {
            throw new IllegalArgumentException("A node type filter needs a type");
        }
        if (kind != Kind.NODE_TYPE) {
            type = null;
        }
    }

    public static TypeFilter ofType(String type) {
        return new TypeFilter(Kind.NODE_TYPE, type);
    }

    public static TypeFilter anyNode() {
        return new TypeFilter(Kind.ANY_NODE, null);
    }

    public static TypeFilter literal() {
        return new TypeFilter(Kind.LITERAL, null);
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    boolean matches(Triple triple, TripleSource source) {
        return switch (kind) {
            case LITERAL -> triple.literal();
            case ANY_NODE -> !triple.literal();
            case NODE_TYPE -> !triple.literal() && source.typeOf(triple.object()).map(type::equals).orElse(false);
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NODE_TYPE -> type;
            case ANY_NODE -> "*";
            case LITERAL -> "literal";
        };
    }
}
