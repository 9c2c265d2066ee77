package asdl.schema.ast;

import java.util.List;

import asdl.source.Location;

import com.google.common.collect.ImmutableList;

/**
 * Root of a parsed ASDL file: {@code module Name { definitions }}.
 * Nothing is resolved at this stage, see {@link asdl.schema.GrammarValidator}.
 */
public class ModuleDef {

    public final List<TypeDef> definitions;
    private final String name;
    private final String sourceName;
    private final Location location;

    public ModuleDef(String name, List<TypeDef> definitions, String sourceName, Location location) {
        this.name = name;
        this.definitions = ImmutableList.copyOf(definitions);
        this.sourceName = sourceName;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    /** File or resource the module was read from, for diagnostics. */
    public String getSourceName() {
        return sourceName;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "module " + name + " " + definitions;
    }
}
