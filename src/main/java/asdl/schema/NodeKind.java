package asdl.schema;

import java.util.List;

import asdl.source.Location;

import com.google.common.collect.ImmutableList;

/**
 * One constructor of a closed grammar: the tag of a node in the tagged
 * union over all constructors. Products contribute one kind named after
 * the type.
 */
public final class NodeKind {
    private final String name;
    private final int tag;
    private final int ordinal;
    private final NodeType type;
    private final Location location;
    private ImmutableList<Slot> slots = ImmutableList.of();
    private int triviaSlot = -1;

    NodeKind(String name, int tag, int ordinal, NodeType type, Location location) {
        this.name = name;
        this.tag = tag;
        this.ordinal = ordinal;
        this.type = type;
        this.location = location;
    }

    void setSlots(List<Slot> slots) {
        this.slots = ImmutableList.copyOf(slots);
        this.triviaSlot = -1;
        for (Slot s : slots) {
            if (s.isTrivia()) {
                triviaSlot = s.getIndex();
                break;
            }
        }
    }

    public String getName() {
        return name;
    }

    /**
     * Dense discriminant over all kinds of the grammar, in declaration
     * order. Stable as long as the schema's declaration order is.
     */
    public int getTag() {
        return tag;
    }

    /** Index of this kind among the kinds of its type. */
    public int getOrdinal() {
        return ordinal;
    }

    public NodeType getType() {
        return type;
    }

    public Grammar getGrammar() {
        return type.getGrammar();
    }

    public Location getLocation() {
        return location;
    }

    /** Declared fields followed by the type's attributes. */
    public ImmutableList<Slot> getSlots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public Slot getSlot(int index) {
        return slots.get(index);
    }

    public Slot getSlot(String slotName) {
        for (Slot s : slots) {
            if (s.getName().equals(slotName)) {
                return s;
            }
        }
        throw new IllegalArgumentException(name + " has no field named " + slotName);
    }

    public boolean hasSlot(String slotName) {
        for (Slot s : slots) {
            if (s.getName().equals(slotName)) {
                return true;
            }
        }
        return false;
    }

    /** Index of the trivia field, or -1 if this kind carries no trivia. */
    public int getTriviaSlot() {
        return triviaSlot;
    }

    public boolean hasTrivia() {
        return triviaSlot >= 0;
    }

    public boolean isProduct() {
        return !type.isSum();
    }

    @Override
    public String toString() {
        return name + "#" + tag;
    }
}
