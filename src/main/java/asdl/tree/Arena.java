package asdl.tree;

import java.util.List;

import org.apache.log4j.Logger;

import asdl.Logging;
import asdl.schema.BuiltinType;
import asdl.schema.Grammar;
import asdl.schema.NodeKind;
import asdl.schema.Slot;
import asdl.source.Location;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Owns all nodes of one tree.
 * <p>
 * An arena is filled bottom-up by the thread that created it: a node can
 * only refer to handles that this arena handed out before, so trees are
 * acyclic and never share nodes with other arenas. {@link #freeze()}
 * ends construction; afterwards any thread may read. {@link #close()}
 * releases the whole tree, after which every access fails.
 */
public final class Arena implements AutoCloseable {
    private static final Logger logger = Logging.getLogger();

    private enum State {
        BUILDING, FROZEN, CLOSED
    }

    private final Grammar grammar;
    private final Thread owner;
    private final List<Node> nodes = Lists.newArrayList();
    private volatile State state = State.BUILDING;

    public Arena(Grammar grammar) {
        this.grammar = grammar;
        this.owner = Thread.currentThread();
    }

    public Grammar grammar() {
        return grammar;
    }

    public Handle allocate(String constructor, Object... fields) {
        return allocate(constructor, Location.NONE, fields);
    }

    public Handle allocate(String constructor, Location location, Object... fields) {
        if (!grammar.hasKind(constructor)) {
            throw new TreeConstructionException("Grammar " + grammar.getName() + " has no constructor " + constructor);
        }
        return allocate(grammar.kind(constructor), location, fields);
    }

    /**
     * Creates a node. Values are given in slot order: the constructor's
     * fields followed by the type's attributes. Optional values may be
     * null, sequences are {@link List}s, node values are handles of this
     * arena.
     */
    public Handle allocate(NodeKind kind, Location location, Object... fields) {
        checkBuilding();
        if (kind.getGrammar() != grammar) {
            throw new TreeConstructionException("Kind " + kind.getName() + " belongs to another grammar");
        }
        if (fields.length != kind.size()) {
            throw new TreeConstructionException(kind.getName() + " expects " + kind.size()
                    + " values " + kind.getSlots() + " but got " + fields.length);
        }
        Object[] values = new Object[fields.length];
        for (Slot slot : kind.getSlots()) {
            values[slot.getIndex()] = checkSlot(kind, slot, fields[slot.getIndex()]);
        }
        Handle handle = new Handle(this, nodes.size());
        nodes.add(new Node(this, handle, kind, location == null ? Location.NONE : location, values));
        return handle;
    }

    private Object checkSlot(NodeKind kind, Slot slot, Object value) {
        if (slot.isTrivia() && value instanceof Trivia && ((Trivia) value).isEmpty()) {
            // empty trivia is stored as absent
            value = null;
        }
        if (value == null) {
            if (slot.isOptional()) {
                return null;
            }
            throw new TreeConstructionException("Missing value for " + describe(kind, slot));
        }
        if (!slot.isSequence()) {
            return checkValue(kind, slot, value);
        }
        if (!(value instanceof List)) {
            throw new TreeConstructionException(describe(kind, slot) + " expects a List but got "
                    + value.getClass().getName());
        }
        ImmutableList.Builder<Object> elements = ImmutableList.builder();
        for (Object element : (List<?>) value) {
            if (element == null) {
                throw new TreeConstructionException("null element in " + describe(kind, slot));
            }
            elements.add(checkValue(kind, slot, element));
        }
        return elements.build();
    }

    private Object checkValue(NodeKind kind, Slot slot, Object value) {
        if (slot.getType() instanceof BuiltinType) {
            Object stored = ((BuiltinType) slot.getType()).coerce(value);
            if (stored == null) {
                throw new TreeConstructionException(describe(kind, slot) + " does not accept "
                        + value.getClass().getName() + " value " + value);
            }
            return stored;
        }
        if (!(value instanceof Handle)) {
            throw new TreeConstructionException(describe(kind, slot) + " expects a Handle but got "
                    + value.getClass().getName());
        }
        Handle h = (Handle) value;
        if (!h.belongsTo(this)) {
            throw new TreeConstructionException(describe(kind, slot) + " refers to a node of another arena");
        }
        NodeKind childKind = nodes.get(h.index()).kind();
        if (childKind.getType() != slot.getType()) {
            throw new TreeConstructionException(describe(kind, slot) + " cannot hold a "
                    + childKind.getName() + " (type " + childKind.getType().getName() + ")");
        }
        return h;
    }

    private static String describe(NodeKind kind, Slot slot) {
        return "field '" + slot + "' of " + kind.getName();
    }

    public Node node(Handle handle) {
        checkReadable();
        if (!handle.belongsTo(this)) {
            throw new TreeConstructionException("Handle " + handle + " belongs to another arena");
        }
        return nodes.get(handle.index());
    }

    public int size() {
        checkReadable();
        return nodes.size();
    }

    /** Ends construction. Freezing twice is allowed. */
    public void freeze() {
        if (state == State.BUILDING) {
            checkOwner();
            state = State.FROZEN;
            logger.debug("froze arena for " + grammar.getName() + " with " + nodes.size() + " nodes");
        } else if (state == State.CLOSED) {
            throw new TreeConstructionException("Arena is closed");
        }
    }

    public boolean isFrozen() {
        return state == State.FROZEN;
    }

    public boolean isClosed() {
        return state == State.CLOSED;
    }

    @Override
    public void close() {
        state = State.CLOSED;
        nodes.clear();
    }

    private void checkBuilding() {
        State s = state;
        if (s == State.FROZEN) {
            throw new TreeConstructionException("Arena is frozen");
        }
        if (s == State.CLOSED) {
            throw new TreeConstructionException("Arena is closed");
        }
        checkOwner();
    }

    void checkReadable() {
        State s = state;
        if (s == State.CLOSED) {
            throw new TreeConstructionException("Arena is closed");
        }
        if (s == State.BUILDING && Thread.currentThread() != owner) {
            throw new TreeConstructionException("Arena is still under construction by thread " + owner.getName());
        }
    }

    private void checkOwner() {
        if (Thread.currentThread() != owner) {
            throw new TreeConstructionException("Arena is owned by thread " + owner.getName()
                    + ", not " + Thread.currentThread().getName());
        }
    }

    @Override
    public String toString() {
        return "Arena(" + grammar.getName() + ", " + state + ")";
    }
}
