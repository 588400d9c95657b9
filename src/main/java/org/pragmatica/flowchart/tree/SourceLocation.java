package org.pragmatica.flowchart.tree;

/**
 * A position in source text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(1, 1);

    /**
     * Sentinel for diagnostics and nodes that have no position in the source.
     */
    public static final SourceLocation UNKNOWN = new SourceLocation(-1, -1);

    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column);
    }

    public boolean isKnown() {
        return line > 0 && column > 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
