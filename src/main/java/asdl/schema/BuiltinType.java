package asdl.schema;

import asdl.tree.Trivia;

/**
 * The scalar types every schema may use without declaring them.
 * {@code trivia} marks the constructors that carry formatting trivia.
 */
public enum BuiltinType implements ValueType {
    IDENTIFIER("identifier", String.class),
    STRING("string", String.class),
    INT("int", Long.class),
    FLOAT("float", Double.class),
    BOOL("bool", Boolean.class),
    TRIVIA("trivia", Trivia.class);

    private final String asdlName;
    private final Class<?> javaType;

    BuiltinType(String asdlName, Class<?> javaType) {
        this.asdlName = asdlName;
        this.javaType = javaType;
    }

    @Override
    public String getName() {
        return asdlName;
    }

    @Override
    public boolean isNode() {
        return false;
    }

    /** The Java class of stored values. */
    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * Converts a value to its stored form: ints widen to {@code Long},
     * floats to {@code Double}.
     *
     * @return the stored value, or null if the value has the wrong type
     */
    public Object coerce(Object value) {
        switch (this) {
            case INT:
                if (value instanceof Long) {
                    return value;
                }
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                return null;
            case FLOAT:
                if (value instanceof Double) {
                    return value;
                }
                if (value instanceof Float) {
                    return ((Float) value).doubleValue();
                }
                return null;
            default:
                return javaType.isInstance(value) ? value : null;
        }
    }

    public static BuiltinType forName(String name) {
        for (BuiltinType t : values()) {
            if (t.asdlName.equals(name)) {
                return t;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return asdlName;
    }
}
