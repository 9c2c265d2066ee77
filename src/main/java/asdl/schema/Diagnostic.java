package asdl.schema;

import asdl.source.Location;

/**
 * One problem found while reading or validating a schema.
 */
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final String name;
    private final Location location;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String name, Location location, String message) {
        this.kind = kind;
        this.name = name;
        this.location = location;
        this.message = message;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    /** The offending identifier (or token text for syntax errors). */
    public String getName() {
        return name;
    }

    public Location getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return location + ": " + kind + ": " + message;
    }
}
