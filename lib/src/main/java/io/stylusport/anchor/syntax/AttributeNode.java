package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

/**
 * An attribute such as {@code #[account(mut)]}. The argument text is kept verbatim as it appears
 * between the delimiters (or after {@code =}); interpreting it is left to the caller.
 */
public final class AttributeNode {

    public enum ArgumentStyle {
        NONE,
        PARENTHESIZED,
        BRACKETED,
        BRACED,
        ASSIGNED
    }

    private final SourceLocation location;
    private final boolean inner;
    private final List<String> path;
    private final ArgumentStyle argumentStyle;
    private final String argumentText;

    public AttributeNode(
            SourceLocation location,
            boolean inner,
            List<String> path,
            ArgumentStyle argumentStyle,
            String argumentText) {
        this.location = Objects.requireNonNull(location, "location");
        this.inner = inner;
        this.path = List.copyOf(path);
        this.argumentStyle = Objects.requireNonNull(argumentStyle, "argumentStyle");
        this.argumentText = Objects.requireNonNull(argumentText, "argumentText");
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isInner() {
        return inner;
    }

    public List<String> getPath() {
        return path;
    }

    public String getPathText() {
        return String.join("::", path);
    }

    /** True when the attribute path is exactly the single identifier {@code name}. */
    public boolean isIdent(String name) {
        return path.size() == 1 && path.get(0).equals(name);
    }

    public ArgumentStyle getArgumentStyle() {
        return argumentStyle;
    }

    public boolean hasArguments() {
        return argumentStyle != ArgumentStyle.NONE;
    }

    public String getArgumentText() {
        return argumentText;
    }

    @Override
    public String toString() {
        switch (argumentStyle) {
            case PARENTHESIZED:
                return "#[" + getPathText() + "(" + argumentText + ")]";
            case BRACKETED:
                return "#[" + getPathText() + "[" + argumentText + "]]";
            case BRACED:
                return "#[" + getPathText() + "{" + argumentText + "}]";
            case ASSIGNED:
                return "#[" + getPathText() + " = " + argumentText + "]";
            default:
                return "#[" + getPathText() + "]";
        }
    }
}
