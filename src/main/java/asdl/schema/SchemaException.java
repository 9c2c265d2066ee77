package asdl.schema;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A schema could not be turned into a grammar. Carries every diagnostic
 * found, not only the first one.
 */
public abstract class SchemaException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String sourceName;
    private final ImmutableList<Diagnostic> diagnostics;

    protected SchemaException(String sourceName, List<Diagnostic> diagnostics) {
        super(sourceName + ": " + diagnostics.size() + " error(s)\n  " + Joiner.on("\n  ").join(diagnostics));
        this.sourceName = sourceName;
        this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    public String getSourceName() {
        return sourceName;
    }

    public ImmutableList<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
