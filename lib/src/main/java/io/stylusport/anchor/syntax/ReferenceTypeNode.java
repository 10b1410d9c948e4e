package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

public final class ReferenceTypeNode extends TypeNode {
    private final String lifetime;
    private final boolean mutable;
    private final TypeNode referent;

    public ReferenceTypeNode(
            SourceLocation location, List<String> tokens, String lifetime, boolean mutable, TypeNode referent) {
        super(location, tokens);
        this.lifetime = lifetime;
        this.mutable = mutable;
        this.referent = Objects.requireNonNull(referent, "referent");
    }

    public String getLifetime() {
        return lifetime;
    }

    public boolean isMutable() {
        return mutable;
    }

    public TypeNode getReferent() {
        return referent;
    }

    /** Follows nested references down to the first non-reference type. */
    public TypeNode stripReferences() {
        TypeNode current = referent;
        while (current instanceof ReferenceTypeNode) {
            current = ((ReferenceTypeNode) current).getReferent();
        }
        return current;
    }
}
