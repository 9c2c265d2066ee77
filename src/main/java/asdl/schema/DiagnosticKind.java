package asdl.schema;

public enum DiagnosticKind {
    /** malformed ASDL text */
    SCHEMA_SYNTAX,
    /** a field type that is neither builtin nor declared */
    UNRESOLVED_TYPE,
    /** a type, constructor or field name declared twice */
    DUPLICATE_DECLARATION,
    /** a type that cannot be built as a finite tree */
    INVALID_RECURSION,
    /** a trivia field that is required, repeated or listed twice */
    INVALID_TRIVIA
}
