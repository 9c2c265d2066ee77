package asdl.schema.ast;

public enum Multiplicity {
    REQUIRED(""), OPTIONAL("?"), SEQUENCE("*");

    private final String suffix;

    Multiplicity(String suffix) {
        this.suffix = suffix;
    }

    /** The marker written after the type name in ASDL source. */
    public String getSuffix() {
        return suffix;
    }

    public static Multiplicity fromSuffix(String suffix) {
        if (suffix == null || suffix.isEmpty()) {
            return REQUIRED;
        }
        for (Multiplicity m : values()) {
            if (m.suffix.equals(suffix)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown multiplicity: " + suffix);
    }
}
