package asdl.tree.print;

/**
 * Pickled text that does not describe a tree of the expected grammar.
 */
public class TreeReadException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int offset;

    public TreeReadException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    /** Character offset into the input where reading failed. */
    public int getOffset() {
        return offset;
    }
}
