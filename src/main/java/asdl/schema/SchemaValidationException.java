package asdl.schema;

import java.util.List;

/** The ASDL text parses, but names or recursion are invalid. */
public class SchemaValidationException extends SchemaException {
    private static final long serialVersionUID = 1L;

    public SchemaValidationException(String sourceName, List<Diagnostic> diagnostics) {
        super(sourceName, diagnostics);
    }
}
