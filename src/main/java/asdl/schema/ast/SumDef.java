package asdl.schema.ast;

import java.util.List;

import asdl.source.Location;

import com.google.common.collect.ImmutableList;

public class SumDef extends TypeDef {

    public final List<ConstructorDef> constructors;

    public SumDef(String name, List<ConstructorDef> constructors, List<FieldDef> attributes, Location location) {
        super(name, attributes, location);
        this.constructors = ImmutableList.copyOf(constructors);
    }

    @Override
    public boolean isSum() {
        return true;
    }

    @Override
    public List<ConstructorDef> getConstructors() {
        return constructors;
    }

    /** A sum is simple if none of its constructors has fields and it has no attributes. */
    public boolean isSimple() {
        if (!attributes.isEmpty()) {
            return false;
        }
        for (ConstructorDef c : constructors) {
            if (!c.fields.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(getName() + " = ");
        boolean first = true;
        for (ConstructorDef c : constructors) {
            if (!first) result.append(" | ");
            result.append(c);
            first = false;
        }
        return result.append(attributesToString()).toString();
    }
}
