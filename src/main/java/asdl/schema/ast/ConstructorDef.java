package asdl.schema.ast;

import java.util.List;

import asdl.source.Location;

import com.google.common.collect.ImmutableList;

public class ConstructorDef {

    public final List<FieldDef> fields;
    private final String name;
    private final Location location;

    public ConstructorDef(String name, List<FieldDef> fields, Location location) {
        this.name = name;
        this.fields = ImmutableList.copyOf(fields);
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(name);
        if (fields.isEmpty()) {
            return result.toString();
        }
        result.append("(");
        boolean first = true;
        for (FieldDef f : fields) {
            if (!first) {
                result.append(", ");
            }
            result.append(f);
            first = false;
        }
        result.append(")");
        return result.toString();
    }
}
