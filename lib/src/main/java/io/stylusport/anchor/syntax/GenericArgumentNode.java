package io.stylusport.anchor.syntax;

import java.util.Objects;

public final class GenericArgumentNode {

    public enum Kind {
        LIFETIME,
        TYPE,
        BINDING,
        CONST
    }

    private final Kind kind;
    private final String text;
    private final TypeNode type;

    private GenericArgumentNode(Kind kind, String text, TypeNode type) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.type = type;
    }

    public static GenericArgumentNode lifetime(String lifetime) {
        return new GenericArgumentNode(Kind.LIFETIME, lifetime, null);
    }

    public static GenericArgumentNode type(TypeNode type) {
        return new GenericArgumentNode(Kind.TYPE, TypeText.canonical(type), type);
    }

    public static GenericArgumentNode binding(String name, TypeNode type) {
        return new GenericArgumentNode(Kind.BINDING, name + "=" + TypeText.canonical(type), type);
    }

    public static GenericArgumentNode constant(String text) {
        return new GenericArgumentNode(Kind.CONST, text, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    /** The argument type for {@link Kind#TYPE} and {@link Kind#BINDING}; null otherwise. */
    public TypeNode getType() {
        return type;
    }
}
