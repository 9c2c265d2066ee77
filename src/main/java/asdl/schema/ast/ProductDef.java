package asdl.schema.ast;

import java.util.List;

import asdl.source.Location;

import com.google.common.collect.ImmutableList;

public class ProductDef extends TypeDef {

    public final List<FieldDef> fields;
    private final ConstructorDef asConstructor;

    public ProductDef(String name, List<FieldDef> fields, List<FieldDef> attributes, Location location) {
        super(name, attributes, location);
        this.fields = ImmutableList.copyOf(fields);
        this.asConstructor = new ConstructorDef(name, fields, location);
    }

    @Override
    public boolean isSum() {
        return false;
    }

    @Override
    public List<ConstructorDef> getConstructors() {
        return ImmutableList.of(asConstructor);
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(getName() + " = (");
        boolean first = true;
        for (FieldDef f : fields) {
            if (!first) result.append(", ");
            result.append(f);
            first = false;
        }
        return result.append(")").append(attributesToString()).toString();
    }
}
