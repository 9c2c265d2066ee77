package asdl.source;

import com.google.common.base.Preconditions;

/**
 * Start/end span of a construct in some source text, used for diagnostics
 * on schemas and as the location metadata of tree nodes.
 */
public final class Location {
    public static final Location NONE = new Location(SourcePosition.UNKNOWN, SourcePosition.UNKNOWN);

    private final SourcePosition start;
    private final SourcePosition end;

    public Location(SourcePosition start, SourcePosition end) {
        this.start = Preconditions.checkNotNull(start);
        this.end = Preconditions.checkNotNull(end);
    }

    public static Location of(int startLine, int startColumn, int endLine, int endColumn) {
        return new Location(new SourcePosition(startLine, startColumn), new SourcePosition(endLine, endColumn));
    }

    public static Location at(int line, int column) {
        SourcePosition p = new SourcePosition(line, column);
        return new Location(p, p);
    }

    public SourcePosition getStart() {
        return start;
    }

    public SourcePosition getEnd() {
        return end;
    }

    public boolean isKnown() {
        return start.isKnown();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Location) {
            Location other = (Location) obj;
            return start.equals(other.start) && end.equals(other.end);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return start.hashCode() ^ (end.hashCode() * 17);
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "<unknown>";
        }
        if (start.equals(end)) {
            return start.toString();
        }
        return start + "-" + end;
    }
}
