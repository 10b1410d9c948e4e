package io.stylusport.anchor.syntax;

import java.util.List;

public final class PathTypeNode extends TypeNode {
    private final boolean global;
    private final List<PathSegmentNode> segments;

    public PathTypeNode(
            SourceLocation location, List<String> tokens, boolean global, List<PathSegmentNode> segments) {
        super(location, tokens);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Path type requires at least one segment");
        }
        this.global = global;
        this.segments = List.copyOf(segments);
    }

    /** True for paths starting with {@code ::}. */
    public boolean isGlobal() {
        return global;
    }

    public List<PathSegmentNode> getSegments() {
        return segments;
    }

    public PathSegmentNode getLastSegment() {
        return segments.get(segments.size() - 1);
    }
}
