package com.arbor.ast;

/**
 * A range of source text, used for diagnostics.
 *
 * <p>Lines and columns are 1-based. {@link #EMPTY} marks a node whose location is unknown.</p>
 */
public record SourceSpan(String file, Position start, Position end) {

    public static final SourceSpan EMPTY = new SourceSpan(null, Position.UNKNOWN, Position.UNKNOWN);

    public SourceSpan {
        if (start == null) {
            start = Position.UNKNOWN;
        }
        if (end == null) {
            end = Position.UNKNOWN;
        }
    }

    public static SourceSpan of(String file, int line, int column) {
        return new SourceSpan(file, new Position(line, column), Position.UNKNOWN);
    }

    public static SourceSpan of(String file, int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceSpan(file, new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    /**
     * True for the {@link #EMPTY} sentinel. A node whose own span is empty inherits its parent's.
     */
    public boolean isEmpty() {
        return equals(EMPTY);
    }

    /**
     * True when the start position points at real source text.
     */
    public boolean isValid() {
        return start.line() > 0;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "<unknown>";
        }
        StringBuilder sb = new StringBuilder();
        if (file != null) {
            sb.append(file);
        }
        sb.append('(').append(start.line()).append(',').append(start.column()).append(')');
        return sb.toString();
    }

    public record Position(int line, int column) {
        public static final Position UNKNOWN = new Position(-1, -1);
    }
}
