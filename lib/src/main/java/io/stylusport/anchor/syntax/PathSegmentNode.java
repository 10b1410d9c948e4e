package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PathSegmentNode {

    public enum ArgumentStyle {
        NONE,
        ANGLE_BRACKETED,
        PARENTHESIZED
    }

    private final String identifier;
    private final ArgumentStyle argumentStyle;
    private final List<GenericArgumentNode> arguments;

    public PathSegmentNode(String identifier, ArgumentStyle argumentStyle, List<GenericArgumentNode> arguments) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.argumentStyle = Objects.requireNonNull(argumentStyle, "argumentStyle");
        this.arguments = List.copyOf(arguments);
    }

    public String getIdentifier() {
        return identifier;
    }

    public ArgumentStyle getArgumentStyle() {
        return argumentStyle;
    }

    public List<GenericArgumentNode> getArguments() {
        return arguments;
    }

    /** Angle-bracketed arguments that are types, skipping lifetimes, bindings and const values. */
    public List<TypeNode> getTypeArguments() {
        if (argumentStyle != ArgumentStyle.ANGLE_BRACKETED) {
            return List.of();
        }
        return arguments.stream()
                .filter(argument -> argument.getKind() == GenericArgumentNode.Kind.TYPE)
                .map(GenericArgumentNode::getType)
                .collect(Collectors.toList());
    }
}
