package asdl.gen;

import static asdl.gen.JavaNames.toFirstUpper;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import asdl.Logging;
import asdl.schema.BuiltinType;
import asdl.schema.Grammar;
import asdl.schema.NodeKind;
import asdl.schema.NodeType;
import asdl.schema.Slot;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Generates typed Java sources for a grammar: a sealed root interface
 * with the visitor interfaces, one sealed interface per sum type, one
 * final view class per constructor and product, and a factory class
 * holding the grammar and the construction functions.
 * <p>
 * The view classes only wrap arena nodes; all storage and validation is
 * done by {@link asdl.tree.Arena}.
 */
@SuppressWarnings("StringConcatenationInsideStringBufferAppend")
public class Generator {
    private static final Logger logger = Logging.getLogger();

    private static final Set<String> RESERVED_METHODS = Sets.newHashSet(
            "getLocation", "getClass", "hashCode", "toString", "node", "handle", "trivia", "accept", "match");

    /** Static methods of the factory class besides the construction functions. */
    private static final Set<String> FACTORY_METHODS = Sets.newHashSet(
            "kind", "newArena", "handle", "handles", "view");

    private final FileGenerator fileGenerator;
    private final Grammar grammar;
    private final String schemaText;
    private final String schemaName;
    private final String packageName;
    private final String typePrefix;
    private final String mainName;

    public Generator(FileGenerator fileGenerator, Grammar grammar, GeneratorOptions options, String schemaText) {
        this.fileGenerator = fileGenerator;
        this.grammar = grammar;
        this.schemaText = schemaText;
        this.schemaName = new File(grammar.getSourceName()).getName();
        this.packageName = options.getPackageName();
        this.typePrefix = options.getTypePrefix();
        this.mainName = options.getFactoryName();
    }

    public void generate() {
        checkNames();

        generateElementInterface();
        for (NodeType t : grammar.getTypes()) {
            if (t.isSum()) {
                generateSumInterface(t);
            }
            for (NodeKind k : t.getKinds()) {
                generateViewClass(k);
            }
        }
        generateFactoryClass();
        logger.info("generated " + fileGenerator.getWrittenFiles().size() + " files for " + grammar.getName()
                + " in " + fileGenerator.getOutputFolder() + " (" + fileGenerator.getChangedCount() + " changed)");
    }

    /**
     * Fails if two schema names map to the same Java name.
     */
    private void checkNames() {
        List<String> problems = Lists.newArrayList();

        Map<String, String> classes = Maps.newHashMap();
        addName(classes, getCommonSupertypeType(), "the root interface", problems);
        addName(classes, mainName, "the factory class", problems);
        for (NodeType t : grammar.getTypes()) {
            if (t.isSum()) {
                addName(classes, className(t), "type " + t.getName(), problems);
            }
            for (NodeKind k : t.getKinds()) {
                addName(classes, className(k), "constructor " + k.getName(), problems);
            }
        }
        for (String c : classes.keySet()) {
            if (JavaNames.RESERVED_CLASS_NAMES.contains(c)) {
                problems.add("class name " + c + " (" + classes.get(c) + ") is reserved");
            }
        }

        Map<String, String> constants = Maps.newHashMap();
        for (NodeKind k : grammar.getKinds()) {
            addName(constants, tagConstant(k), "constructor " + k.getName(), problems);
            if (JavaNames.isKeyword(k.getName()) || FACTORY_METHODS.contains(k.getName())) {
                problems.add("construction function " + k.getName() + " of " + mainName + " is reserved");
            }
        }

        for (NodeKind k : grammar.getKinds()) {
            Map<String, String> methods = Maps.newHashMap();
            Map<String, String> parameters = Maps.newHashMap();
            for (Slot s : k.getSlots()) {
                String owner = "field " + s.getName() + " of " + k.getName();
                addName(methods, getter(s), owner, problems);
                if (s.isOptional()) {
                    addName(methods, "has" + toFirstUpper(s.getName()), owner, problems);
                }
                if (s.isSequence()) {
                    addName(methods, getter(s) + "Length", owner, problems);
                }
                addName(parameters, JavaNames.variable(s.getName()), owner, problems);
            }
            for (String m : methods.keySet()) {
                if (RESERVED_METHODS.contains(m)) {
                    problems.add("method " + m + " for " + methods.get(m) + " clashes with a generated method");
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Cannot generate Java sources for " + grammar.getName() + ":\n  "
                    + Joiner.on("\n  ").join(problems));
        }
    }

    private static void addName(Map<String, String> names, String name, String owner, List<String> problems) {
        String previous = names.put(name, owner);
        if (previous != null) {
            problems.add(owner + " and " + previous + " both map to " + name);
        }
    }

    private void generateElementInterface() {
        StringBuilder sb = new StringBuilder();
        printProlog(sb);
        String E = getCommonSupertypeType();

        List<String> subs = Lists.newArrayList();
        for (NodeType t : grammar.getTypes()) {
            subs.add(className(t));
        }
        sb.append("/**\n * Root of all nodes of " + grammar.getName() + ".\n */\n");
        sb.append("public sealed interface " + E + " permits " + Joiner.on(", ").join(subs) + " {\n");
        sb.append("    Node node();\n\n");
        sb.append("    default Handle handle() {\n");
        sb.append("        return node().handle();\n");
        sb.append("    }\n\n");
        sb.append("    default Location getLocation() {\n");
        sb.append("        return node().location();\n");
        sb.append("    }\n\n");
        sb.append("    default boolean structuralEquals(" + E + " other) {\n");
        sb.append("        return node().structuralEquals(other.node());\n");
        sb.append("    }\n\n");
        sb.append("    <R> R accept(Visitor<R> v);\n\n");

        sb.append("    /** Nodes whose constructor declares a trivia field. */\n");
        sb.append("    interface TriviaBearing {\n");
        sb.append("        Node node();\n\n");
        sb.append("        default Trivia trivia() {\n");
        sb.append("            return node().trivia();\n");
        sb.append("        }\n");
        sb.append("    }\n\n");

        generateVisitorInterface(sb);
        generateDefaultVisitor(sb);
        generateRebuilder(sb);

        sb.append("}\n");
        fileGenerator.createFile(E + ".java", sb);
    }

    private void generateVisitorInterface(StringBuilder sb) {
        sb.append("    /** One method per constructor; adding a constructor breaks every implementation. */\n");
        sb.append("    interface Visitor<R> {\n");
        for (NodeKind k : grammar.getKinds()) {
            sb.append("        R " + visitMethod(k) + "(" + className(k) + " n);\n");
        }
        sb.append("    }\n\n");
    }

    private void generateDefaultVisitor(StringBuilder sb) {
        sb.append("    /** Visits all children in declared order, skipping absent optionals. */\n");
        sb.append("    abstract class DefaultVisitor implements Visitor<Void> {\n");
        for (NodeKind k : grammar.getKinds()) {
            sb.append("        @Override public Void " + visitMethod(k) + "(" + className(k) + " n) {\n");
            for (Slot s : k.getSlots()) {
                if (!s.isNode()) {
                    continue;
                }
                if (s.isSequence()) {
                    sb.append("            for (" + className((NodeType) s.getType()) + " c : n." + getter(s) + "()) {\n");
                    sb.append("                c.accept(this);\n");
                    sb.append("            }\n");
                } else if (s.isOptional()) {
                    sb.append("            if (n.has" + toFirstUpper(s.getName()) + "()) {\n");
                    sb.append("                n." + getter(s) + "().accept(this);\n");
                    sb.append("            }\n");
                } else {
                    sb.append("            n." + getter(s) + "().accept(this);\n");
                }
            }
            sb.append("            return null;\n");
            sb.append("        }\n");
        }
        sb.append("    }\n\n");
    }

    private void generateRebuilder(StringBuilder sb) {
        String E = getCommonSupertypeType();
        sb.append("    /**\n");
        sb.append("     * Rebuilds visited nodes into {@code target}. Every method copies by\n");
        sb.append("     * default; override the constructors to change.\n");
        sb.append("     */\n");
        sb.append("    abstract class Rebuilder implements Visitor<Handle> {\n");
        sb.append("        protected final Arena target;\n\n");
        sb.append("        protected Rebuilder(Arena target) {\n");
        sb.append("            this.target = target;\n");
        sb.append("        }\n\n");
        sb.append("        public Handle rebuild(" + E + " e) {\n");
        sb.append("            return e.accept(this);\n");
        sb.append("        }\n\n");
        sb.append("        protected List<Handle> rebuildAll(List<? extends " + E + "> elements) {\n");
        sb.append("            List<Handle> result = new ArrayList<>(elements.size());\n");
        sb.append("            for (" + E + " e : elements) {\n");
        sb.append("                result.add(e.accept(this));\n");
        sb.append("            }\n");
        sb.append("            return result;\n");
        sb.append("        }\n\n");
        for (NodeKind k : grammar.getKinds()) {
            sb.append("        @Override public Handle " + visitMethod(k) + "(" + className(k) + " n) {\n");
            sb.append("            return target.allocate(" + mainName + "." + kindConstant(k) + ", n.getLocation(), new Object[] {");
            boolean first = true;
            for (Slot s : k.getSlots()) {
                if (!first) {
                    sb.append(",");
                }
                sb.append("\n                ");
                first = false;
                if (!s.isNode()) {
                    sb.append("n.node().get(" + s.getIndex() + ")");
                } else if (s.isSequence()) {
                    sb.append("rebuildAll(n." + getter(s) + "())");
                } else if (s.isOptional()) {
                    sb.append("n.has" + toFirstUpper(s.getName()) + "() ? n." + getter(s) + "().accept(this) : null");
                } else {
                    sb.append("n." + getter(s) + "().accept(this)");
                }
            }
            sb.append("});\n");
            sb.append("        }\n");
        }
        sb.append("    }\n");
    }

    private void generateSumInterface(NodeType t) {
        StringBuilder sb = new StringBuilder();
        printProlog(sb);
        List<String> subs = Lists.newArrayList();
        for (NodeKind k : t.getKinds()) {
            subs.add(className(k));
        }
        sb.append("public sealed interface " + className(t) + " extends " + getCommonSupertypeType()
                + " permits " + Joiner.on(", ").join(subs) + " {\n");

        for (Slot s : t.getAttributeSlots()) {
            sb.append("    " + javaType(s) + " " + getter(s) + "();\n");
        }
        sb.append("\n");
        generateMatcher(t, sb);
        sb.append("}\n");
        fileGenerator.createFile(className(t) + ".java", sb);
    }

    private void generateMatcher(NodeType t, StringBuilder sb) {
        sb.append("    <T> T match(Matcher<T> s);\n");
        sb.append("    void match(MatcherVoid s);\n\n");

        sb.append("    public interface Matcher<T> {\n");
        for (NodeKind k : t.getKinds()) {
            sb.append("        T case_" + k.getName() + "(" + className(k) + " n);\n");
        }
        sb.append("    }\n\n");

        sb.append("    public interface MatcherVoid {\n");
        for (NodeKind k : t.getKinds()) {
            sb.append("        void case_" + k.getName() + "(" + className(k) + " n);\n");
        }
        sb.append("    }\n");
    }

    private void generateViewClass(NodeKind k) {
        StringBuilder sb = new StringBuilder();
        printProlog(sb);
        String C = className(k);
        String superType = k.isProduct() ? getCommonSupertypeType() : className(k.getType());

        sb.append("public final class " + C + " implements " + superType);
        if (k.hasTrivia()) {
            sb.append(", " + getCommonSupertypeType() + ".TriviaBearing");
        }
        sb.append(" {\n");
        sb.append("    private final Node node;\n\n");
        sb.append("    " + C + "(Node node) {\n");
        sb.append("        this.node = node;\n");
        sb.append("    }\n\n");
        sb.append("    @Override public Node node() {\n");
        sb.append("        return node;\n");
        sb.append("    }\n\n");

        for (Slot s : k.getSlots()) {
            createGetter(s, sb);
        }

        sb.append("    @Override public <R> R accept(" + getCommonSupertypeType() + ".Visitor<R> v) {\n");
        sb.append("        return v." + visitMethod(k) + "(this);\n");
        sb.append("    }\n\n");

        if (!k.isProduct()) {
            String S = className(k.getType());
            sb.append("    @Override public <T> T match(" + S + ".Matcher<T> matcher) {\n");
            sb.append("        return matcher.case_" + k.getName() + "(this);\n");
            sb.append("    }\n\n");
            sb.append("    @Override public void match(" + S + ".MatcherVoid matcher) {\n");
            sb.append("        matcher.case_" + k.getName() + "(this);\n");
            sb.append("    }\n\n");
        }

        sb.append("    @Override public boolean equals(Object o) {\n");
        sb.append("        return o instanceof " + C + " && ((" + C + ") o).node == node;\n");
        sb.append("    }\n\n");
        sb.append("    @Override public int hashCode() {\n");
        sb.append("        return node.hashCode();\n");
        sb.append("    }\n\n");
        sb.append("    @Override public String toString() {\n");
        sb.append("        return Pickler.pickle(node);\n");
        sb.append("    }\n");
        sb.append("}\n");
        fileGenerator.createFile(C + ".java", sb);
    }

    private void createGetter(Slot s, StringBuilder sb) {
        int i = s.getIndex();
        String type = javaType(s);
        if (s.isNode()) {
            String child = className((NodeType) s.getType());
            if (s.isSequence()) {
                sb.append("    public " + type + " " + getter(s) + "() {\n");
                sb.append("        List<" + child + "> result = new ArrayList<>();\n");
                sb.append("        for (Node c : node.children(" + i + ")) {\n");
                sb.append("            result.add((" + child + ") " + mainName + ".view(c));\n");
                sb.append("        }\n");
                sb.append("        return Collections.unmodifiableList(result);\n");
                sb.append("    }\n\n");
            } else {
                if (s.isOptional()) {
                    sb.append("    /** null if absent */\n");
                }
                sb.append("    public " + type + " " + getter(s) + "() {\n");
                sb.append("        return (" + child + ") " + mainName + ".view(node.child(" + i + "));\n");
                sb.append("    }\n\n");
            }
        } else if (s.isSequence()) {
            sb.append("    @SuppressWarnings(\"unchecked\")\n");
            sb.append("    public " + type + " " + getter(s) + "() {\n");
            sb.append("        return (" + type + ") node.get(" + i + ");\n");
            sb.append("    }\n\n");
        } else {
            sb.append("    public " + type + " " + getter(s) + "() {\n");
            sb.append("        return (" + boxedType((BuiltinType) s.getType()) + ") node.get(" + i + ");\n");
            sb.append("    }\n\n");
        }
        if (s.isOptional()) {
            sb.append("    public boolean has" + toFirstUpper(s.getName()) + "() {\n");
            sb.append("        return node.isPresent(" + i + ");\n");
            sb.append("    }\n\n");
        }
        if (s.isSequence()) {
            sb.append("    public int " + getter(s) + "Length() {\n");
            sb.append("        return node.sequenceLength(" + i + ");\n");
            sb.append("    }\n\n");
        }
    }

    private void generateFactoryClass() {
        StringBuilder sb = new StringBuilder();
        printProlog(sb);
        String E = getCommonSupertypeType();

        sb.append("/**\n");
        sb.append(" * Grammar, discriminants and construction functions of " + grammar.getName() + ".\n");
        sb.append(" */\n");
        sb.append("public final class " + mainName + " {\n");
        sb.append("    public static final String SCHEMA =\n            "
                + JavaNames.stringLiteral(schemaText, "            ") + ";\n\n");
        sb.append("    public static final Grammar GRAMMAR = Schemas.fromText(SCHEMA, \"" + schemaName + "\");\n\n");

        for (NodeKind k : grammar.getKinds()) {
            sb.append("    public static final int " + tagConstant(k) + " = " + k.getTag() + ";\n");
        }
        sb.append("\n");
        for (NodeKind k : grammar.getKinds()) {
            sb.append("    public static final NodeKind " + kindConstant(k) + " = kind(\"" + k.getName() + "\", "
                    + tagConstant(k) + ");\n");
        }
        sb.append("\n");

        sb.append("    private " + mainName + "() {\n");
        sb.append("    }\n\n");

        sb.append("    private static NodeKind kind(String name, int tag) {\n");
        sb.append("        NodeKind k = GRAMMAR.kind(name);\n");
        sb.append("        if (k.getTag() != tag) {\n");
        sb.append("            throw new IllegalStateException(\"Discriminant of \" + name + \" is \" + k.getTag()\n");
        sb.append("                    + \" but was generated as \" + tag + \"; regenerate the sources\");\n");
        sb.append("        }\n");
        sb.append("        return k;\n");
        sb.append("    }\n\n");

        sb.append("    public static Arena newArena() {\n");
        sb.append("        return new Arena(GRAMMAR);\n");
        sb.append("    }\n\n");

        for (NodeKind k : grammar.getKinds()) {
            createConstructor(k, sb);
        }

        sb.append("    private static Handle handle(" + E + " e) {\n");
        sb.append("        return e == null ? null : e.handle();\n");
        sb.append("    }\n\n");
        sb.append("    private static List<Handle> handles(List<? extends " + E + "> elements) {\n");
        sb.append("        if (elements == null) {\n");
        sb.append("            return null;\n");
        sb.append("        }\n");
        sb.append("        List<Handle> result = new ArrayList<>(elements.size());\n");
        sb.append("        for (" + E + " e : elements) {\n");
        sb.append("            result.add(handle(e));\n");
        sb.append("        }\n");
        sb.append("        return result;\n");
        sb.append("    }\n\n");

        sb.append("    public static " + E + " view(Tree tree) {\n");
        sb.append("        return view(tree.root());\n");
        sb.append("    }\n\n");
        sb.append("    public static " + E + " view(Arena arena, Handle handle) {\n");
        sb.append("        return view(arena.node(handle));\n");
        sb.append("    }\n\n");
        sb.append("    /** The typed view of a node, null for null. */\n");
        sb.append("    public static " + E + " view(Node node) {\n");
        sb.append("        if (node == null) {\n");
        sb.append("            return null;\n");
        sb.append("        }\n");
        sb.append("        if (node.kind().getGrammar() != GRAMMAR) {\n");
        sb.append("            throw new IllegalArgumentException(\"Node \" + node + \" is not a node of " + mainName
                + ".GRAMMAR\");\n");
        sb.append("        }\n");
        sb.append("        switch (node.kind().getTag()) {\n");
        for (NodeKind k : grammar.getKinds()) {
            sb.append("            case " + tagConstant(k) + ":\n");
            sb.append("                return new " + className(k) + "(node);\n");
        }
        sb.append("            default:\n");
        sb.append("                throw new IllegalStateException(\"Unknown discriminant \" + node.kind().getTag());\n");
        sb.append("        }\n");
        sb.append("    }\n");
        sb.append("}\n");
        fileGenerator.createFile(mainName + ".java", sb);
    }

    private void createConstructor(NodeKind k, StringBuilder sb) {
        String C = className(k);
        List<String> params = Lists.newArrayList();
        List<String> args = Lists.newArrayList();
        List<String> values = Lists.newArrayList();
        for (Slot s : k.getSlots()) {
            String p = JavaNames.variable(s.getName());
            params.add(javaType(s) + " " + p);
            args.add(p);
            if (!s.isNode()) {
                values.add(p);
            } else if (s.isSequence()) {
                values.add("handles(" + p + ")");
            } else {
                values.add("handle(" + p + ")");
            }
        }
        String rest = params.isEmpty() ? "" : ", " + Joiner.on(", ").join(params);
        String restArgs = args.isEmpty() ? "" : ", " + Joiner.on(", ").join(args);

        sb.append("    public static " + C + " " + k.getName() + "(Arena arena, Location location" + rest + ") {\n");
        sb.append("        Handle h = arena.allocate(" + kindConstant(k) + ", location, new Object[] {"
                + Joiner.on(", ").join(values) + "});\n");
        sb.append("        return new " + C + "(arena.node(h));\n");
        sb.append("    }\n\n");

        sb.append("    public static " + C + " " + k.getName() + "(Arena arena" + rest + ") {\n");
        sb.append("        return " + k.getName() + "(arena, Location.NONE" + restArgs + ");\n");
        sb.append("    }\n\n");
    }

    private String javaType(Slot s) {
        String element;
        if (s.isNode()) {
            element = className((NodeType) s.getType());
        } else if (s.isRequired()) {
            element = unboxedType((BuiltinType) s.getType());
        } else {
            element = boxedType((BuiltinType) s.getType());
        }
        return s.isSequence() ? "List<" + element + ">" : element;
    }

    private static String unboxedType(BuiltinType t) {
        switch (t) {
            case INT:
                return "long";
            case FLOAT:
                return "double";
            case BOOL:
                return "boolean";
            default:
                return boxedType(t);
        }
    }

    private static String boxedType(BuiltinType t) {
        return t.getJavaType().getSimpleName();
    }

    private String getter(Slot s) {
        return "get" + toFirstUpper(s.getName());
    }

    private static String visitMethod(NodeKind k) {
        return "visit" + toFirstUpper(k.getName());
    }

    private static String tagConstant(NodeKind k) {
        return "TAG_" + JavaNames.constant(k.getName());
    }

    private static String kindConstant(NodeKind k) {
        return "K_" + JavaNames.constant(k.getName());
    }

    private String className(NodeType t) {
        return typePrefix + toFirstUpper(t.getName());
    }

    private String className(NodeKind k) {
        return k.isProduct() ? className(k.getType()) : typePrefix + k.getName();
    }

    private String getCommonSupertypeType() {
        return typePrefix + "Element";
    }

    private void printProlog(StringBuilder sb) {
        sb.append(FileGenerator.GENERATED_MARKER + " from " + schemaName + ". Do not edit.\n");
        sb.append("package " + packageName + ";\n\n");
        sb.append("import java.util.ArrayList;\n");
        sb.append("import java.util.Collections;\n");
        sb.append("import java.util.List;\n\n");
        sb.append("import asdl.schema.Grammar;\n");
        sb.append("import asdl.schema.NodeKind;\n");
        sb.append("import asdl.schema.Schemas;\n");
        sb.append("import asdl.source.Location;\n");
        sb.append("import asdl.tree.Arena;\n");
        sb.append("import asdl.tree.Handle;\n");
        sb.append("import asdl.tree.Node;\n");
        sb.append("import asdl.tree.Tree;\n");
        sb.append("import asdl.tree.Trivia;\n");
        sb.append("import asdl.tree.print.Pickler;\n\n");
    }
}
