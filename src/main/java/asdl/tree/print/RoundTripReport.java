package asdl.tree.print;

/**
 * Outcome of one round trip: the text written from the original tree,
 * the text written from the tree read back, and whether both trees are
 * structurally equal.
 */
public final class RoundTripReport {
    private final String first;
    private final String second;
    private final boolean structurallyEqual;

    public RoundTripReport(String first, String second, boolean structurallyEqual) {
        this.first = first;
        this.second = second;
        this.structurallyEqual = structurallyEqual;
    }

    public String getFirst() {
        return first;
    }

    public String getSecond() {
        return second;
    }

    public boolean isStructurallyEqual() {
        return structurallyEqual;
    }

    /** Writing the re-read tree reproduces the text. */
    public boolean isStable() {
        return first.equals(second);
    }

    public boolean isSuccessful() {
        return structurallyEqual && isStable();
    }

    @Override
    public String toString() {
        if (isSuccessful()) {
            return "round trip ok";
        }
        return "round trip failed (structurally equal: " + structurallyEqual + ", stable: " + isStable() + ")\n"
                + "--- first\n" + first + "\n--- second\n" + second;
    }
}
