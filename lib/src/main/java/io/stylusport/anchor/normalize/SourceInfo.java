package io.stylusport.anchor.normalize;

import java.util.Objects;
import java.util.Optional;

public record SourceInfo(String filePath, LineRange lineRange) {

    public record LineRange(int start, int end) {
        public LineRange {
            if (start < 1 || end < start) {
                throw new IllegalArgumentException("Invalid line range " + start + ".." + end);
            }
        }
    }

    public SourceInfo {
        Objects.requireNonNull(filePath, "filePath");
    }

    public static SourceInfo of(String filePath) {
        return new SourceInfo(filePath, null);
    }

    public SourceInfo withLineRange(int start, int end) {
        return new SourceInfo(filePath, new LineRange(start, end));
    }

    public Optional<LineRange> lineRangeIfKnown() {
        return Optional.ofNullable(lineRange);
    }
}
