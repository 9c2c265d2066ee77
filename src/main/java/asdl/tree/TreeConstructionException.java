package asdl.tree;

/**
 * A tree was built or accessed against the rules of its {@link Arena}:
 * wrong field values, handles from another arena, allocation after
 * freezing, access after closing or from the wrong thread.
 */
public class TreeConstructionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public TreeConstructionException(String message) {
        super(message);
    }
}
