package asdl.gen;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Mapping of ASDL names to Java identifiers.
 */
public final class JavaNames {
    private static final Set<String> KEYWORDS = ImmutableSet.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "_");

    /** Parameter names used by every generated factory method. */
    private static final Set<String> RESERVED_PARAMETERS = ImmutableSet.of("arena", "location");

    /**
     * Simple names the generated sources use unqualified; a generated class
     * with one of these names would shadow them.
     */
    static final Set<String> RESERVED_CLASS_NAMES = ImmutableSet.of(
            "Object", "String", "Long", "Double", "Boolean", "Override", "SuppressWarnings", "Void",
            "IllegalArgumentException", "IllegalStateException",
            "List", "ArrayList", "Collections",
            "Grammar", "NodeKind", "Schemas", "Location", "Arena", "Handle", "Node", "Tree", "Trivia", "Pickler");

    private JavaNames() {
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    public static String toFirstUpper(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public static String toFirstLower(String name) {
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    /** A parameter or variable name for an ASDL field. */
    public static String variable(String fieldName) {
        if (isKeyword(fieldName) || RESERVED_PARAMETERS.contains(fieldName)) {
            return fieldName + "_";
        }
        return fieldName;
    }

    /** {@code BinOp} becomes {@code BIN_OP}, {@code stmt} becomes {@code STMT}. */
    public static String constant(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (i > 0 && Character.isUpperCase(c) && Character.isLowerCase(name.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }

    public static boolean isIdentifier(String name) {
        if (name.isEmpty() || isKeyword(name) || !Character.isJavaIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isPackageName(String name) {
        for (String part : name.split("\\.", -1)) {
            if (!isIdentifier(part)) {
                return false;
            }
        }
        return true;
    }

    /** A Java string literal, split into one concatenated piece per line. */
    public static String stringLiteral(String text, String indent) {
        StringBuilder sb = new StringBuilder();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i == lines.length - 1 && lines[i].isEmpty() && i > 0) {
                break;
            }
            if (i > 0) {
                sb.append("\n").append(indent).append("+ ");
            }
            sb.append('"');
            for (char c : lines[i].toCharArray()) {
                switch (c) {
                    case '"':
                        sb.append("\\\"");
                        break;
                    case '\\':
                        sb.append("\\\\");
                        break;
                    case '\r':
                        break;
                    case '\t':
                        sb.append("\\t");
                        break;
                    default:
                        if (c < 0x20 || c > 0x7e) {
                            sb.append(String.format("\\u%04x", (int) c));
                        } else {
                            sb.append(c);
                        }
                }
            }
            if (i < lines.length - 1) {
                sb.append("\\n");
            }
            sb.append('"');
        }
        return sb.toString();
    }
}
