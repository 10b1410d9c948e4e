package io.stylusport.anchor.syntax;

/** A 1-based line and column in a named source; renders as {@code source:line:column}. */
public record SourceLocation(String sourceName, int line, int column) {

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
