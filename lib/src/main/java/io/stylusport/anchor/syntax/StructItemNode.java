package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

public final class StructItemNode extends ItemNode {

    public enum Shape {
        NAMED,
        TUPLE,
        UNIT
    }

    private final String name;
    private final Shape shape;
    private final List<FieldNode> fields;

    public StructItemNode(
            SourceLocation location,
            List<AttributeNode> attributes,
            String visibility,
            String name,
            Shape shape,
            List<FieldNode> fields) {
        super(location, attributes, visibility);
        this.name = Objects.requireNonNull(name, "name");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.fields = List.copyOf(fields);
    }

    public String getName() {
        return name;
    }

    public Shape getShape() {
        return shape;
    }

    public List<FieldNode> getFields() {
        return fields;
    }
}
