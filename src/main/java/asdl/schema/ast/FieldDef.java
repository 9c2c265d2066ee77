package asdl.schema.ast;

import asdl.source.Location;

public final class FieldDef {

    private final TypeRef type;
    private final Multiplicity multiplicity;
    private final String name;
    private final boolean named;
    private final Location location;

    public FieldDef(TypeRef type, Multiplicity multiplicity, String name, boolean named, Location location) {
        this.type = type;
        this.multiplicity = multiplicity;
        this.name = name;
        this.named = named;
        this.location = location;
    }

    public TypeRef getType() {
        return type;
    }

    public Multiplicity getMultiplicity() {
        return multiplicity;
    }

    /**
     * The declared name, or for a positional field the name derived from
     * its type.
     */
    public String getName() {
        return name;
    }

    /** false for positional fields written without a name */
    public boolean isNamed() {
        return named;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof FieldDef) {
            FieldDef other = (FieldDef) obj;
            return type.equals(other.type)
                    && multiplicity == other.multiplicity
                    && name.equals(other.name);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return name.hashCode() ^ type.hashCode();
    }

    @Override
    public String toString() {
        return type + multiplicity.getSuffix() + (named ? " " + name : "");
    }
}
