package asdl.tree.visit;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A walker or transformer was built without an operation for some
 * constructors and without a default.
 */
public class MissingOperationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final ImmutableList<String> missing;

    public MissingOperationException(String grammarName, List<String> missing) {
        super("No operation for constructor(s) of " + grammarName + ": " + Joiner.on(", ").join(missing));
        this.missing = ImmutableList.copyOf(missing);
    }

    /** Constructor names without an operation, in discriminant order. */
    public ImmutableList<String> getMissing() {
        return missing;
    }
}
