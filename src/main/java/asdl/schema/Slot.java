package asdl.schema;

import asdl.schema.ast.FieldDef;
import asdl.schema.ast.Multiplicity;

/**
 * A resolved field of a {@link NodeKind}: its position, multiplicity and
 * value type.
 */
public final class Slot {
    private final String name;
    private final int index;
    private final Multiplicity multiplicity;
    private final ValueType type;
    private final boolean attribute;
    private final FieldDef definition;

    Slot(FieldDef definition, int index, ValueType type, boolean attribute) {
        this.name = definition.getName();
        this.index = index;
        this.multiplicity = definition.getMultiplicity();
        this.type = type;
        this.attribute = attribute;
        this.definition = definition;
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    public Multiplicity getMultiplicity() {
        return multiplicity;
    }

    public ValueType getType() {
        return type;
    }

    /** true for fields inherited from the owning type's attributes */
    public boolean isAttribute() {
        return attribute;
    }

    public boolean isNode() {
        return type.isNode();
    }

    public boolean isTrivia() {
        return type == BuiltinType.TRIVIA;
    }

    public boolean isRequired() {
        return multiplicity == Multiplicity.REQUIRED;
    }

    public boolean isOptional() {
        return multiplicity == Multiplicity.OPTIONAL;
    }

    public boolean isSequence() {
        return multiplicity == Multiplicity.SEQUENCE;
    }

    public FieldDef getDefinition() {
        return definition;
    }

    @Override
    public String toString() {
        return type.getName() + multiplicity.getSuffix() + " " + name;
    }
}
