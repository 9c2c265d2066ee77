package asdl.source;

/**
 * Immutable line/column pair. Lines and columns are 1-based,
 * 0 means unknown.
 */
public final class SourcePosition implements Comparable<SourcePosition> {
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    public final int line;
    public final int column;

    public SourcePosition(int line, int column) {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public int compareTo(SourcePosition o) {
        if (line != o.line) {
            return Integer.compare(line, o.line);
        }
        return Integer.compare(column, o.column);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof SourcePosition) {
            SourcePosition other = (SourcePosition) obj;
            return line == other.line && column == other.column;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return line * 31 + column;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
