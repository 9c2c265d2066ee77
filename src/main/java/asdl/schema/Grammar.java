package asdl.schema;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A closed, validated schema: every type reference is resolved and every
 * constructor has its discriminant. Instances are created by
 * {@link GrammarValidator} and are immutable afterwards.
 */
public final class Grammar {
    private final String name;
    private final String sourceName;
    private ImmutableList<NodeType> types = ImmutableList.of();
    private ImmutableList<NodeKind> kinds = ImmutableList.of();
    private ImmutableMap<String, NodeType> typesByName = ImmutableMap.of();
    private ImmutableMap<String, NodeKind> kindsByName = ImmutableMap.of();

    Grammar(String name, String sourceName) {
        this.name = name;
        this.sourceName = sourceName;
    }

    void setTypes(List<NodeType> types, Map<String, NodeType> typesByName) {
        this.types = ImmutableList.copyOf(types);
        this.typesByName = ImmutableMap.copyOf(typesByName);
    }

    void setKinds(List<NodeKind> kinds, Map<String, NodeKind> kindsByName) {
        this.kinds = ImmutableList.copyOf(kinds);
        this.kindsByName = ImmutableMap.copyOf(kindsByName);
    }

    /** The module name. */
    public String getName() {
        return name;
    }

    public String getSourceName() {
        return sourceName;
    }

    public ImmutableList<NodeType> getTypes() {
        return types;
    }

    /** All kinds, indexed by their tag. */
    public ImmutableList<NodeKind> getKinds() {
        return kinds;
    }

    public NodeType type(String typeName) {
        NodeType t = typesByName.get(typeName);
        if (t == null) {
            throw new IllegalArgumentException("Grammar " + name + " declares no type " + typeName);
        }
        return t;
    }

    public boolean hasType(String typeName) {
        return typesByName.containsKey(typeName);
    }

    public NodeKind kind(String constructorName) {
        NodeKind k = kindsByName.get(constructorName);
        if (k == null) {
            throw new IllegalArgumentException("Grammar " + name + " declares no constructor " + constructorName);
        }
        return k;
    }

    public boolean hasKind(String constructorName) {
        return kindsByName.containsKey(constructorName);
    }

    public NodeKind kind(int tag) {
        if (tag < 0 || tag >= kinds.size()) {
            throw new IllegalArgumentException("Tag out of range: " + tag);
        }
        return kinds.get(tag);
    }

    @Override
    public String toString() {
        return "grammar " + name + " (" + types.size() + " types, " + kinds.size() + " constructors)";
    }
}
