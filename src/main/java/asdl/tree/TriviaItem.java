package asdl.tree;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * One formatting item kept alongside a statement node.
 */
public final class TriviaItem {
    private static final TriviaItem END_OF_LINE = new TriviaItem(TriviaKind.END_OF_LINE, "");
    private static final TriviaItem SEMICOLON = new TriviaItem(TriviaKind.SEMICOLON, "");

    private final TriviaKind kind;
    private final String text;

    private TriviaItem(TriviaKind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    /** A comment on its own line; {@code text} excludes the comment marker. */
    public static TriviaItem comment(String text) {
        return new TriviaItem(TriviaKind.COMMENT, checkText(text));
    }

    public static TriviaItem eolComment(String text) {
        return new TriviaItem(TriviaKind.EOL_COMMENT, checkText(text));
    }

    public static TriviaItem endOfLine() {
        return END_OF_LINE;
    }

    public static TriviaItem semicolon() {
        return SEMICOLON;
    }

    private static String checkText(String text) {
        Preconditions.checkNotNull(text);
        Preconditions.checkArgument(text.indexOf('\n') < 0 && text.indexOf('\r') < 0,
                "comment text must not contain line breaks: %s", text);
        return text;
    }

    public TriviaKind getKind() {
        return kind;
    }

    /** Comment text, empty for line ends and semicolons. */
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TriviaItem)) {
            return false;
        }
        TriviaItem other = (TriviaItem) o;
        return kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        switch (kind) {
            case COMMENT:
                return "Comment(" + text + ")";
            case EOL_COMMENT:
                return "EOLComment(" + text + ")";
            case END_OF_LINE:
                return "EndOfLine";
            default:
                return "Semicolon";
        }
    }
}
