package asdl.schema.ast;

import asdl.source.Location;

/**
 * A use of a type name in a field. Resolution to a builtin or a declared
 * type happens in the validator.
 */
public final class TypeRef {
    private final String name;
    private final Location location;

    public TypeRef(String name, Location location) {
        this.name = name;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TypeRef && ((TypeRef) obj).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
