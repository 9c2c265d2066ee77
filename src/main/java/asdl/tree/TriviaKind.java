package asdl.tree;

/**
 * The items that may appear between statements.
 */
public enum TriviaKind {
    /** A comment on a line of its own. */
    COMMENT,
    /** A comment that ends the current statement line. */
    EOL_COMMENT,
    END_OF_LINE,
    SEMICOLON
}
