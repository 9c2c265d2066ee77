package asdl.tree;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Comments, line ends and separators attached to a statement.
 * <p>
 * {@code inside} follows the statement header (for example after
 * {@code IF x THEN}), {@code after} follows the whole statement. Each
 * sequence either is empty, which stands for a plain line end, or first
 * ends the statement line with exactly one of END_OF_LINE, SEMICOLON or
 * EOL_COMMENT. After a SEMICOLON only a line end or an end-of-line comment
 * may follow; on a fresh line only comments and blank lines may follow.
 */
public final class Trivia {
    public static final Trivia EMPTY = new Trivia(ImmutableList.of(), ImmutableList.of());

    /** Where a trivia sequence leaves the output line. */
    public enum LineState {
        /** The statement line is still open. */
        OPEN,
        /** The statement line was ended by a semicolon; another statement may follow on it. */
        SEPARATED,
        /** On a fresh line. */
        CLOSED
    }

    private final ImmutableList<TriviaItem> inside;
    private final ImmutableList<TriviaItem> after;

    private Trivia(ImmutableList<TriviaItem> inside, ImmutableList<TriviaItem> after) {
        this.inside = inside;
        this.after = after;
    }

    public static Trivia of(List<TriviaItem> inside, List<TriviaItem> after) {
        ImmutableList<TriviaItem> i = ImmutableList.copyOf(inside);
        ImmutableList<TriviaItem> a = ImmutableList.copyOf(after);
        endState(i);
        endState(a);
        if (i.isEmpty() && a.isEmpty()) {
            return EMPTY;
        }
        return new Trivia(i, a);
    }

    public static Trivia after(TriviaItem... items) {
        return of(ImmutableList.of(), ImmutableList.copyOf(items));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks a sequence and returns the line state it ends in; an empty
     * sequence ends CLOSED through its implicit line end.
     *
     * @throws IllegalArgumentException if the sequence is not well formed
     */
    public static LineState endState(List<TriviaItem> items) {
        if (items.isEmpty()) {
            return LineState.CLOSED;
        }
        LineState state = LineState.OPEN;
        for (int i = 0; i < items.size(); i++) {
            state = step(state, items.get(i), items, i);
        }
        if (state == LineState.OPEN) {
            throw new IllegalArgumentException("trivia does not end the statement line: " + show(items));
        }
        return state;
    }

    private static LineState step(LineState state, TriviaItem item, List<TriviaItem> items, int index) {
        TriviaKind kind = item.getKind();
        switch (state) {
            case OPEN:
                if (kind == TriviaKind.END_OF_LINE || kind == TriviaKind.EOL_COMMENT) {
                    return LineState.CLOSED;
                }
                if (kind == TriviaKind.SEMICOLON) {
                    return LineState.SEPARATED;
                }
                break;
            case SEPARATED:
                if (kind == TriviaKind.END_OF_LINE || kind == TriviaKind.EOL_COMMENT) {
                    return LineState.CLOSED;
                }
                break;
            case CLOSED:
                if (kind == TriviaKind.END_OF_LINE || kind == TriviaKind.COMMENT) {
                    return LineState.CLOSED;
                }
                break;
        }
        throw new IllegalArgumentException("unexpected " + item + " at position " + index
                + " (line state " + state + ") in trivia " + show(items));
    }

    private static String show(List<TriviaItem> items) {
        return "[" + Joiner.on(", ").join(items) + "]";
    }

    public ImmutableList<TriviaItem> getInside() {
        return inside;
    }

    public ImmutableList<TriviaItem> getAfter() {
        return after;
    }

    public boolean isEmpty() {
        return inside.isEmpty() && after.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Trivia)) {
            return false;
        }
        Trivia other = (Trivia) o;
        return inside.equals(other.inside) && after.equals(other.after);
    }

    @Override
    public int hashCode() {
        return 31 * inside.hashCode() + after.hashCode();
    }

    @Override
    public String toString() {
        return "Trivia(" + show(inside) + ", " + show(after) + ")";
    }

    /**
     * Collects the two sequences item by item; {@link #build()} validates
     * them.
     */
    public static final class Builder {
        private final ImmutableList.Builder<TriviaItem> inside = ImmutableList.builder();
        private final ImmutableList.Builder<TriviaItem> after = ImmutableList.builder();

        private Builder() {
        }

        public Builder inside(TriviaItem item) {
            inside.add(item);
            return this;
        }

        public Builder after(TriviaItem item) {
            after.add(item);
            return this;
        }

        public Trivia build() {
            return of(inside.build(), after.build());
        }
    }
}
