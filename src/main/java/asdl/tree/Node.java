package asdl.tree;

import java.util.List;

import asdl.schema.NodeKind;
import asdl.schema.Slot;
import asdl.source.Location;

import com.google.common.collect.ImmutableList;

/**
 * An immutable node of an {@link Arena}: its kind, location and one value
 * per slot. Required slots hold a value, optional slots a value or null,
 * sequence slots an immutable list. Node values are {@link Handle}s; the
 * {@code child} and {@code children} accessors resolve them.
 */
public final class Node {
    private final Arena arena;
    private final Handle handle;
    private final NodeKind kind;
    private final Location location;
    private final Object[] values;

    Node(Arena arena, Handle handle, NodeKind kind, Location location, Object[] values) {
        this.arena = arena;
        this.handle = handle;
        this.kind = kind;
        this.location = location;
        this.values = values;
    }

    public Arena arena() {
        return arena;
    }

    public Handle handle() {
        return handle;
    }

    public NodeKind kind() {
        return kind;
    }

    public Location location() {
        return location;
    }

    /** Raw value of a slot; null for an absent optional. */
    public Object get(int slot) {
        arena.checkReadable();
        return values[slot];
    }

    public Object get(String field) {
        return get(kind.getSlot(field).getIndex());
    }

    public boolean isPresent(int slot) {
        return get(slot) != null;
    }

    public boolean isPresent(String field) {
        return isPresent(kind.getSlot(field).getIndex());
    }

    public int sequenceLength(int slot) {
        return sequence(slot).size();
    }

    public int sequenceLength(String field) {
        return sequenceLength(kind.getSlot(field).getIndex());
    }

    /** The child of a required or optional node slot, or null if absent. */
    public Node child(int slot) {
        Slot s = nodeSlot(slot);
        if (s.isSequence()) {
            throw new IllegalArgumentException(s + " of " + kind.getName() + " is a sequence, use children()");
        }
        Handle h = (Handle) get(slot);
        return h == null ? null : arena.node(h);
    }

    public Node child(String field) {
        return child(kind.getSlot(field).getIndex());
    }

    public List<Node> children(int slot) {
        nodeSlot(slot);
        ImmutableList.Builder<Node> result = ImmutableList.builder();
        for (Object h : sequence(slot)) {
            result.add(arena.node((Handle) h));
        }
        return result.build();
    }

    public List<Node> children(String field) {
        return children(kind.getSlot(field).getIndex());
    }

    /**
     * Handles of all children in slot order, sequence elements in place,
     * absent optionals skipped.
     */
    public List<Handle> childHandles() {
        arena.checkReadable();
        ImmutableList.Builder<Handle> result = ImmutableList.builder();
        for (Slot s : kind.getSlots()) {
            Object v = values[s.getIndex()];
            if (!s.isNode() || v == null) {
                continue;
            }
            if (s.isSequence()) {
                for (Object h : (List<?>) v) {
                    result.add((Handle) h);
                }
            } else {
                result.add((Handle) v);
            }
        }
        return result.build();
    }

    /** The node's trivia; {@link Trivia#EMPTY} when absent or not supported by the kind. */
    public Trivia trivia() {
        if (!kind.hasTrivia()) {
            return Trivia.EMPTY;
        }
        Trivia t = (Trivia) get(kind.getTriviaSlot());
        return t == null ? Trivia.EMPTY : t;
    }

    /** Equality of the subtrees, ignoring locations. */
    public boolean structuralEquals(Node other) {
        return TreeEquality.equal(this, other);
    }

    private List<?> sequence(int slot) {
        Slot s = kind.getSlot(slot);
        if (!s.isSequence()) {
            throw new IllegalArgumentException(s + " of " + kind.getName() + " is not a sequence");
        }
        return (List<?>) get(slot);
    }

    private Slot nodeSlot(int slot) {
        Slot s = kind.getSlot(slot);
        if (!s.isNode()) {
            throw new IllegalArgumentException(s + " of " + kind.getName() + " does not hold nodes");
        }
        return s;
    }

    @Override
    public String toString() {
        return kind.getName() + handle;
    }
}
