package asdl.schema;

/**
 * The type of a slot: either a {@link BuiltinType} scalar or a declared
 * {@link NodeType}.
 */
public interface ValueType {

    String getName();

    /** true if values of this type are node handles */
    boolean isNode();
}
