package io.stylusport.anchor.syntax;

import java.util.Objects;

/** A {@code self} receiver in any of its forms. */
public final class ReceiverParameterNode implements ParameterNode {
    private final SourceLocation location;
    private final String text;

    public ReceiverParameterNode(SourceLocation location, String text) {
        this.location = Objects.requireNonNull(location, "location");
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getText() {
        return text;
    }
}
