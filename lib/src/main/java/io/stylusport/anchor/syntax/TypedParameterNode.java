package io.stylusport.anchor.syntax;

import java.util.Objects;

public final class TypedParameterNode implements ParameterNode {
    private final SourceLocation location;
    private final String identifier;
    private final String patternText;
    private final TypeNode type;

    public TypedParameterNode(SourceLocation location, String identifier, String patternText, TypeNode type) {
        this.location = Objects.requireNonNull(location, "location");
        this.identifier = identifier;
        this.patternText = Objects.requireNonNull(patternText, "patternText");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    /** Bound identifier for plain identifier patterns; null for wildcards and destructuring patterns. */
    public String getIdentifier() {
        return identifier;
    }

    public String getPatternText() {
        return patternText;
    }

    public TypeNode getType() {
        return type;
    }
}
