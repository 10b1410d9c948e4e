package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

public final class ModuleItemNode extends ItemNode {
    private final String name;
    private final boolean inline;
    private final List<ItemNode> items;

    public ModuleItemNode(
            SourceLocation location,
            List<AttributeNode> attributes,
            String visibility,
            String name,
            boolean inline,
            List<ItemNode> items) {
        super(location, attributes, visibility);
        this.name = Objects.requireNonNull(name, "name");
        this.inline = inline;
        this.items = List.copyOf(items);
    }

    public String getName() {
        return name;
    }

    /** False for {@code mod name;} declarations whose content lives in another file. */
    public boolean isInline() {
        return inline;
    }

    public List<ItemNode> getItems() {
        return items;
    }
}
