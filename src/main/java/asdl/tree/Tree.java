package asdl.tree;

/**
 * An arena together with the handle of its root node.
 */
public final class Tree implements AutoCloseable {
    private final Arena arena;
    private final Handle root;

    public Tree(Arena arena, Handle root) {
        if (!root.belongsTo(arena)) {
            throw new TreeConstructionException("Root " + root + " does not belong to " + arena);
        }
        this.arena = arena;
        this.root = root;
    }

    public Arena getArena() {
        return arena;
    }

    public Handle getRoot() {
        return root;
    }

    public Node root() {
        return arena.node(root);
    }

    @Override
    public void close() {
        arena.close();
    }

    @Override
    public String toString() {
        return "Tree(" + root() + ")";
    }
}
