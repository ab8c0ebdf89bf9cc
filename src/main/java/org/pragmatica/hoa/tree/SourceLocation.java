package org.pragmatica.hoa.tree;

/**
 * A position in source text (line and column, both 0-based).
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(0, 0);

    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column);
    }

    /**
     * Human-facing form, 1-based.
     */
    public String display() {
        return "line " + (line + 1) + ", column " + (column + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
