package asdl.tree.print;

import java.util.List;
import java.util.regex.Pattern;

import asdl.schema.BuiltinType;
import asdl.schema.Slot;
import asdl.tree.Handle;
import asdl.tree.Node;
import asdl.tree.Tree;
import asdl.tree.Trivia;
import asdl.tree.TriviaItem;
import asdl.tree.visit.Walker;

/**
 * Writes a tree in its canonical S-expression form, e.g.
 * {@code (If (Name x) [(Assign y (Num 1))] ())}.
 * <p>
 * Absent optionals are written {@code ()}, sequences {@code [a b]},
 * strings quoted with backslash escapes, identifiers bare when they are
 * plain words. Trivia is written {@code (Trivia [inside] [after])}.
 * {@link TreeReader} reads the same format back.
 */
public final class Pickler {
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final StringBuilder sb = new StringBuilder();

    private Pickler() {
    }

    public static String pickle(Tree tree) {
        return pickle(tree.root());
    }

    public static String pickle(Node node) {
        Pickler p = new Pickler();
        Walker walker = Walker.builder(node.kind().getGrammar())
                .otherwise((w, n) -> p.writeNode(w, n))
                .build();
        walker.walk(node);
        return p.sb.toString();
    }

    /**
     * Text up to a child node is buffered and handed to the walker, so it
     * lands in the output in order with the child.
     */
    private void writeNode(Walker walker, Node node) {
        StringBuilder chunk = new StringBuilder();
        chunk.append('(').append(node.kind().getName());
        for (Slot s : node.kind().getSlots()) {
            chunk.append(' ');
            Object v = node.get(s.getIndex());
            if (v == null) {
                chunk.append("()");
            } else if (s.isSequence()) {
                chunk.append('[');
                List<?> elements = (List<?>) v;
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) {
                        chunk.append(' ');
                    }
                    chunk = writeValue(walker, chunk, node, s, elements.get(i));
                }
                chunk.append(']');
            } else {
                chunk = writeValue(walker, chunk, node, s, v);
            }
        }
        chunk.append(')');
        flush(walker, chunk);
    }

    /** @return the buffer to continue with */
    private StringBuilder writeValue(Walker walker, StringBuilder chunk, Node parent, Slot slot, Object v) {
        if (slot.isNode()) {
            flush(walker, chunk);
            walker.walk(parent.arena().node((Handle) v));
            return new StringBuilder();
        }
        switch ((BuiltinType) slot.getType()) {
            case IDENTIFIER:
                String id = (String) v;
                if (PLAIN_IDENTIFIER.matcher(id).matches()) {
                    chunk.append(id);
                } else {
                    writeString(chunk, id);
                }
                break;
            case STRING:
                writeString(chunk, (String) v);
                break;
            case TRIVIA:
                writeTrivia(chunk, (Trivia) v);
                break;
            default:
                // int, float, bool
                chunk.append(v);
        }
        return chunk;
    }

    private void flush(Walker walker, StringBuilder chunk) {
        String text = chunk.toString();
        walker.then(() -> sb.append(text));
    }

    private static void writeTrivia(StringBuilder sb, Trivia t) {
        sb.append("(Trivia ");
        writeItems(sb, t.getInside());
        sb.append(' ');
        writeItems(sb, t.getAfter());
        sb.append(')');
    }

    private static void writeItems(StringBuilder sb, List<TriviaItem> items) {
        sb.append('[');
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            TriviaItem item = items.get(i);
            switch (item.getKind()) {
                case END_OF_LINE:
                    sb.append("(EndOfLine)");
                    break;
                case SEMICOLON:
                    sb.append("(Semicolon)");
                    break;
                case COMMENT:
                    sb.append("(Comment ");
                    writeString(sb, item.getText());
                    sb.append(')');
                    break;
                case EOL_COMMENT:
                    sb.append("(EOLComment ");
                    writeString(sb, item.getText());
                    sb.append(')');
                    break;
            }
        }
        sb.append(']');
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }
}
