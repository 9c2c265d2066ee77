package asdl.tree;

/**
 * Opaque reference to a node of one {@link Arena}. Handles are only
 * created by {@link Arena#allocate}, and compare by identity.
 */
public final class Handle {
    private final Arena arena;
    private final int index;

    Handle(Arena arena, int index) {
        this.arena = arena;
        this.index = index;
    }

    Arena arena() {
        return arena;
    }

    /** Allocation order within the arena; children always have smaller indexes than their parents. */
    public int index() {
        return index;
    }

    public boolean belongsTo(Arena a) {
        return arena == a;
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
