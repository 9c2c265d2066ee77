package asdl.schema;

import java.util.List;

/** The ASDL text is malformed. */
public class SchemaSyntaxException extends SchemaException {
    private static final long serialVersionUID = 1L;

    public SchemaSyntaxException(String sourceName, List<Diagnostic> diagnostics) {
        super(sourceName, diagnostics);
    }
}
