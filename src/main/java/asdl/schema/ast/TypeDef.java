package asdl.schema.ast;

import java.util.List;

import asdl.source.Location;

import com.google.common.collect.ImmutableList;

/**
 * One definition of a module: a sum or a product type.
 */
public abstract class TypeDef {

    /** Fields stored on every value of the type, after its own fields. */
    public final List<FieldDef> attributes;
    private final String name;
    private final Location location;

    protected TypeDef(String name, List<FieldDef> attributes, Location location) {
        this.name = name;
        this.attributes = ImmutableList.copyOf(attributes);
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public Location getLocation() {
        return location;
    }

    public abstract boolean isSum();

    /**
     * The constructors of this type. A product is treated as a single
     * constructor carrying the type's own name.
     */
    public abstract List<ConstructorDef> getConstructors();

    protected String attributesToString() {
        if (attributes.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(" attributes (");
        boolean first = true;
        for (FieldDef f : attributes) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(f);
            first = false;
        }
        return sb.append(")").toString();
    }
}
