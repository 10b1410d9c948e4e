package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

public final class FieldNode {
    private final SourceLocation location;
    private final List<AttributeNode> attributes;
    private final String visibility;
    private final String name;
    private final TypeNode type;

    public FieldNode(
            SourceLocation location,
            List<AttributeNode> attributes,
            String visibility,
            String name,
            TypeNode type) {
        this.location = Objects.requireNonNull(location, "location");
        this.attributes = List.copyOf(attributes);
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<AttributeNode> getAttributes() {
        return attributes;
    }

    public String getVisibility() {
        return visibility;
    }

    /** Field name, or null for positional fields of tuple structs. */
    public String getName() {
        return name;
    }

    public boolean isNamed() {
        return name != null;
    }

    public TypeNode getType() {
        return type;
    }
}
