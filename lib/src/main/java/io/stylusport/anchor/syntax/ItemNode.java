package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A top-level or module-level item. Only the item kinds the model builder inspects get a dedicated
 * subtype; everything else is an {@link OtherItemNode}.
 */
public sealed abstract class ItemNode
        permits ModuleItemNode, FunctionItemNode, StructItemNode, OtherItemNode {

    private final SourceLocation location;
    private final List<AttributeNode> attributes;
    private final String visibility;

    protected ItemNode(SourceLocation location, List<AttributeNode> attributes, String visibility) {
        this.location = Objects.requireNonNull(location, "location");
        this.attributes = List.copyOf(attributes);
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<AttributeNode> getAttributes() {
        return attributes;
    }

    /** Visibility as written, e.g. {@code pub} or {@code pub(crate)}; empty when inherited. */
    public String getVisibility() {
        return visibility;
    }
}
