package asdl.schema;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import asdl.Logging;
import asdl.schema.ast.ConstructorDef;
import asdl.schema.ast.FieldDef;
import asdl.schema.ast.ModuleDef;
import asdl.schema.ast.Multiplicity;
import asdl.schema.ast.ProductDef;
import asdl.schema.ast.SumDef;
import asdl.schema.ast.TypeDef;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Closes a parsed module into a {@link Grammar}.
 * <p>
 * All problems of one module are collected before failing: duplicate
 * names, unresolved field types, misplaced trivia fields and types that
 * admit no finite value. A type admits a finite value when (for a
 * product) all of its required node fields do, or (for a sum) when at
 * least one constructor's required node fields all do. Optional and
 * sequence fields always terminate, so recursion through them is fine.
 * <p>
 * Discriminants are assigned densely in declaration order, sum
 * constructors and products alike.
 */
public class GrammarValidator {
    private static final Logger logger = Logging.getLogger();

    private final ModuleDef module;
    private final List<Diagnostic> errors = Lists.newArrayList();
    private final Map<String, TypeDef> declared = Maps.newLinkedHashMap();

    private GrammarValidator(ModuleDef module) {
        this.module = module;
    }

    public static Grammar validate(ModuleDef module) throws SchemaValidationException {
        return new GrammarValidator(module).run();
    }

    private Grammar run() throws SchemaValidationException {
        collectDeclarations();
        checkConstructors();
        checkRecursion();
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(module.getSourceName(), errors);
        }
        Grammar grammar = buildGrammar();
        logger.debug("validated " + grammar);
        return grammar;
    }

    private void error(DiagnosticKind kind, String name, asdl.source.Location location, String message) {
        errors.add(new Diagnostic(kind, name, location, message));
    }

    private void collectDeclarations() {
        for (TypeDef d : module.definitions) {
            String name = d.getName();
            if (BuiltinType.forName(name) != null) {
                error(DiagnosticKind.DUPLICATE_DECLARATION, name, d.getLocation(),
                        "type " + name + " shadows the builtin type of the same name");
            } else if (declared.containsKey(name)) {
                error(DiagnosticKind.DUPLICATE_DECLARATION, name, d.getLocation(),
                        "type " + name + " is already declared at " + declared.get(name).getLocation());
            } else {
                declared.put(name, d);
            }
        }
    }

    private void checkConstructors() {
        Map<String, TypeDef> constructorOwners = Maps.newHashMap();
        for (TypeDef d : declared.values()) {
            checkFieldTypes(d.attributes, "attributes of " + d.getName());
            checkUniqueNames(d.attributes, "attributes of " + d.getName());
            for (ConstructorDef c : d.getConstructors()) {
                if (d.isSum()) {
                    TypeDef previous = constructorOwners.put(c.getName(), d);
                    if (previous != null) {
                        error(DiagnosticKind.DUPLICATE_DECLARATION, c.getName(), c.getLocation(),
                                "constructor " + c.getName() + " is already declared in type " + previous.getName());
                    }
                }
                List<FieldDef> all = Lists.newArrayList(c.fields);
                all.addAll(d.attributes);
                checkUniqueNames(all, c.getName());
                checkFieldTypes(c.fields, c.getName());
                checkTrivia(c, all);
            }
        }
    }

    private void checkUniqueNames(List<FieldDef> fields, String owner) {
        Set<String> seen = Sets.newHashSet();
        for (FieldDef f : fields) {
            if (!seen.add(f.getName())) {
                error(DiagnosticKind.DUPLICATE_DECLARATION, f.getName(), f.getLocation(),
                        "field " + f.getName() + " is declared twice in " + owner);
            }
        }
    }

    private void checkFieldTypes(List<FieldDef> fields, String owner) {
        for (FieldDef f : fields) {
            String typeName = f.getType().getName();
            if (BuiltinType.forName(typeName) == null && !declared.containsKey(typeName)) {
                error(DiagnosticKind.UNRESOLVED_TYPE, typeName, f.getType().getLocation(),
                        "unknown type " + typeName + " in field " + f.getName() + " of " + owner);
            }
        }
    }

    private void checkTrivia(ConstructorDef c, List<FieldDef> fields) {
        int count = 0;
        for (FieldDef f : fields) {
            if (!f.getType().getName().equals(BuiltinType.TRIVIA.getName())) {
                continue;
            }
            count++;
            if (f.getMultiplicity() != Multiplicity.OPTIONAL) {
                error(DiagnosticKind.INVALID_TRIVIA, f.getName(), f.getLocation(),
                        "trivia field " + f.getName() + " of " + c.getName() + " must be optional (trivia?)");
            } else if (count > 1) {
                error(DiagnosticKind.INVALID_TRIVIA, f.getName(), f.getLocation(),
                        c.getName() + " declares more than one trivia field");
            }
        }
    }

    private void checkRecursion() {
        Set<String> constructible = Sets.newHashSet();
        boolean changed;
        do {
            changed = false;
            for (TypeDef d : declared.values()) {
                if (!constructible.contains(d.getName()) && isConstructible(d, constructible)) {
                    constructible.add(d.getName());
                    changed = true;
                }
            }
        } while (changed);
        // terminates: every round adds at least one type

        for (TypeDef d : declared.values()) {
            if (constructible.contains(d.getName())) {
                continue;
            }
            List<String> path = Lists.newArrayList();
            String current = d.getName();
            while (current != null && !path.contains(current)) {
                path.add(current);
                current = blockingType(declared.get(current), constructible);
            }
            List<String> cycle = Lists.newArrayList();
            if (current != null) {
                cycle.addAll(path.subList(path.indexOf(current), path.size()));
                cycle.add(current);
            }
            error(DiagnosticKind.INVALID_RECURSION, d.getName(), d.getLocation(),
                    "type " + d.getName() + " has no finite value; required fields form the cycle "
                            + Joiner.on(" -> ").join(cycle)
                            + " (make one of them optional or a sequence, or add a constructor without it)");
        }
    }

    private boolean isConstructible(TypeDef d, Set<String> constructible) {
        if (!allFieldsConstructible(d.attributes, constructible)) {
            return false;
        }
        if (d instanceof ProductDef) {
            return allFieldsConstructible(((ProductDef) d).fields, constructible);
        }
        for (ConstructorDef c : ((SumDef) d).constructors) {
            if (allFieldsConstructible(c.fields, constructible)) {
                return true;
            }
        }
        return false;
    }

    private boolean allFieldsConstructible(List<FieldDef> fields, Set<String> constructible) {
        for (FieldDef f : fields) {
            if (blocks(f, constructible)) {
                return false;
            }
        }
        return true;
    }

    /** A required field of a declared type not yet known to be constructible. */
    private boolean blocks(FieldDef f, Set<String> constructible) {
        String typeName = f.getType().getName();
        return f.getMultiplicity() == Multiplicity.REQUIRED
                && declared.containsKey(typeName)
                && !constructible.contains(typeName);
    }

    private String blockingType(TypeDef d, Set<String> constructible) {
        List<FieldDef> candidates = Lists.newArrayList(d.getConstructors().get(0).fields);
        candidates.addAll(d.attributes);
        for (FieldDef f : candidates) {
            if (blocks(f, constructible)) {
                return f.getType().getName();
            }
        }
        return null;
    }

    private Grammar buildGrammar() {
        Grammar grammar = new Grammar(module.getName(), module.getSourceName());

        List<NodeType> types = Lists.newArrayList();
        Map<String, NodeType> typesByName = Maps.newLinkedHashMap();
        for (TypeDef d : declared.values()) {
            NodeType t = new NodeType(d, grammar);
            types.add(t);
            typesByName.put(d.getName(), t);
        }

        List<NodeKind> kinds = Lists.newArrayList();
        Map<String, NodeKind> kindsByName = Maps.newLinkedHashMap();
        int tag = 0;
        for (NodeType t : types) {
            List<NodeKind> ofType = Lists.newArrayList();
            int ordinal = 0;
            for (ConstructorDef c : t.getDefinition().getConstructors()) {
                NodeKind k = new NodeKind(c.getName(), tag++, ordinal++, t, c.getLocation());
                List<Slot> slots = Lists.newArrayList();
                for (FieldDef f : c.fields) {
                    slots.add(new Slot(f, slots.size(), resolve(f, typesByName), false));
                }
                for (FieldDef f : t.getDefinition().attributes) {
                    slots.add(new Slot(f, slots.size(), resolve(f, typesByName), true));
                }
                k.setSlots(slots);
                ofType.add(k);
                kinds.add(k);
                kindsByName.put(k.getName(), k);
            }
            t.setKinds(ofType);
        }

        grammar.setTypes(types, typesByName);
        grammar.setKinds(kinds, kindsByName);
        return grammar;
    }

    private static ValueType resolve(FieldDef f, Map<String, NodeType> typesByName) {
        BuiltinType builtin = BuiltinType.forName(f.getType().getName());
        if (builtin != null) {
            return builtin;
        }
        return typesByName.get(f.getType().getName());
    }
}
