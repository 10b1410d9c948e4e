package io.stylusport.anchor.syntax;

import java.util.List;

public final class SourceFileNode {
    private final String sourceName;
    private final List<AttributeNode> innerAttributes;
    private final List<ItemNode> items;

    public SourceFileNode(String sourceName, List<AttributeNode> innerAttributes, List<ItemNode> items) {
        this.sourceName = sourceName;
        this.innerAttributes = List.copyOf(innerAttributes);
        this.items = List.copyOf(items);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<AttributeNode> getInnerAttributes() {
        return innerAttributes;
    }

    public List<ItemNode> getItems() {
        return items;
    }
}
