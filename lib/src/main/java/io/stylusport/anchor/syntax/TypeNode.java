package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A type as written in source. Every node keeps the texts of the tokens it was parsed from so it can
 * be rendered back independently of the original spacing; see {@link TypeText}.
 */
public sealed abstract class TypeNode permits PathTypeNode, ReferenceTypeNode, OpaqueTypeNode {

    private final SourceLocation location;
    private final List<String> tokens;

    protected TypeNode(SourceLocation location, List<String> tokens) {
        this.location = Objects.requireNonNull(location, "location");
        this.tokens = List.copyOf(tokens);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<String> getTokens() {
        return tokens;
    }

    @Override
    public String toString() {
        return TypeText.canonical(this);
    }
}
