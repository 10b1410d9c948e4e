package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

public final class FunctionItemNode extends ItemNode {
    private final String name;
    private final List<ParameterNode> parameters;
    private final TypeNode returnType;

    public FunctionItemNode(
            SourceLocation location,
            List<AttributeNode> attributes,
            String visibility,
            String name,
            List<ParameterNode> parameters,
            TypeNode returnType) {
        super(location, attributes, visibility);
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(parameters);
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    public List<ParameterNode> getParameters() {
        return parameters;
    }

    /** Declared return type, or null when the function returns unit implicitly. */
    public TypeNode getReturnType() {
        return returnType;
    }
}
