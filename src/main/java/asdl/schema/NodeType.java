package asdl.schema;

import java.util.List;

import asdl.schema.ast.TypeDef;

import com.google.common.collect.ImmutableList;

/**
 * A declared sum or product type of a closed grammar.
 */
public final class NodeType implements ValueType {
    private final String name;
    private final TypeDef definition;
    private final Grammar grammar;
    private ImmutableList<NodeKind> kinds = ImmutableList.of();

    NodeType(TypeDef definition, Grammar grammar) {
        this.name = definition.getName();
        this.definition = definition;
        this.grammar = grammar;
    }

    void setKinds(List<NodeKind> kinds) {
        this.kinds = ImmutableList.copyOf(kinds);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isNode() {
        return true;
    }

    public boolean isSum() {
        return definition.isSum();
    }

    public TypeDef getDefinition() {
        return definition;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    /** The constructors of the type, in declaration order. */
    public ImmutableList<NodeKind> getKinds() {
        return kinds;
    }

    /** The attribute slots every kind of this type carries. */
    public ImmutableList<Slot> getAttributeSlots() {
        ImmutableList.Builder<Slot> result = ImmutableList.builder();
        for (Slot s : kinds.get(0).getSlots()) {
            if (s.isAttribute()) {
                result.add(s);
            }
        }
        return result.build();
    }

    @Override
    public String toString() {
        return name;
    }
}
