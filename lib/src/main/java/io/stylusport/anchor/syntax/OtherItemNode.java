package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

public final class OtherItemNode extends ItemNode {
    private final String leadingKeyword;

    public OtherItemNode(
            SourceLocation location, List<AttributeNode> attributes, String visibility, String leadingKeyword) {
        super(location, attributes, visibility);
        this.leadingKeyword = Objects.requireNonNull(leadingKeyword, "leadingKeyword");
    }

    /** First token of the item, e.g. {@code use}, {@code impl} or a macro name. */
    public String getLeadingKeyword() {
        return leadingKeyword;
    }
}
