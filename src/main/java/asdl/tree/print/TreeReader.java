package asdl.tree.print;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import asdl.schema.BuiltinType;
import asdl.schema.Grammar;
import asdl.schema.NodeKind;
import asdl.schema.NodeType;
import asdl.schema.Slot;
import asdl.source.Location;
import asdl.tree.Arena;
import asdl.tree.Handle;
import asdl.tree.Tree;
import asdl.tree.Trivia;
import asdl.tree.TriviaItem;

import com.google.common.collect.Lists;

/**
 * Reads the format written by {@link Pickler} into a new, frozen arena.
 * Reading is directed by the grammar: each slot's declared type decides
 * what is expected next.
 */
public final class TreeReader {
    private final Grammar grammar;
    private final String text;
    private final Arena arena;
    private int pos = 0;

    private TreeReader(Grammar grammar, String text) {
        this.grammar = grammar;
        this.text = text;
        this.arena = new Arena(grammar);
    }

    public static Tree read(Grammar grammar, String text) {
        TreeReader r = new TreeReader(grammar, text);
        Handle root = r.readTree();
        r.skipWhitespace();
        if (r.pos < text.length()) {
            throw new TreeReadException("Unexpected text after the root node", r.pos);
        }
        r.arena.freeze();
        return new Tree(r.arena, root);
    }

    /** A node whose closing parenthesis has not been read yet. */
    private static final class Frame {
        final NodeKind kind;
        final Object[] values;
        int slot = 0;
        /** elements of the sequence being read, or null */
        List<Object> elements;

        Frame(NodeKind kind) {
            this.kind = kind;
            this.values = new Object[kind.size()];
        }

        Slot current() {
            return kind.getSlot(slot);
        }

        void add(Object value) {
            if (elements != null) {
                elements.add(value);
            } else {
                values[slot++] = value;
            }
        }
    }

    /** Reads nested nodes with an explicit stack of open frames. */
    private Handle readTree() {
        Deque<Frame> open = new ArrayDeque<>();
        Frame frame = openNode(null);
        while (true) {
            if (frame.elements != null) {
                Slot s = frame.current();
                if (peek() == ']') {
                    expect(']');
                    frame.values[frame.slot++] = frame.elements;
                    frame.elements = null;
                } else if (s.isNode()) {
                    open.push(frame);
                    frame = openNode((NodeType) s.getType());
                } else {
                    frame.add(readBuiltin(s));
                }
                continue;
            }
            if (frame.slot == frame.kind.size()) {
                expect(')');
                Handle h = arena.allocate(frame.kind, Location.NONE, frame.values);
                if (open.isEmpty()) {
                    return h;
                }
                frame = open.pop();
                frame.add(h);
                continue;
            }
            Slot s = frame.current();
            if (s.isSequence()) {
                expect('[');
                frame.elements = Lists.newArrayList();
            } else if (s.isOptional() && peek() == '(' && peekAfterParen() == ')') {
                expect('(');
                expect(')');
                frame.add(null);
            } else if (s.isNode()) {
                open.push(frame);
                frame = openNode((NodeType) s.getType());
            } else {
                frame.add(readBuiltin(s));
            }
        }
    }

    /**
     * @param expected the type the node must have, or null for any
     */
    private Frame openNode(NodeType expected) {
        expect('(');
        int start = pos;
        String name = readAtom();
        if (!grammar.hasKind(name)) {
            throw new TreeReadException("Unknown constructor " + name, start);
        }
        NodeKind kind = grammar.kind(name);
        if (expected != null && kind.getType() != expected) {
            throw new TreeReadException(name + " is not a constructor of type " + expected.getName(), start);
        }
        return new Frame(kind);
    }

    private Object readBuiltin(Slot s) {
        int start = pos;
        switch ((BuiltinType) s.getType()) {
            case IDENTIFIER:
                return peek() == '"' ? readString() : readAtom();
            case STRING:
                return readString();
            case INT:
                String i = readAtom();
                try {
                    return Long.parseLong(i);
                } catch (NumberFormatException e) {
                    throw new TreeReadException("Expected an int but found " + i, start);
                }
            case FLOAT:
                String f = readAtom();
                try {
                    return Double.parseDouble(f);
                } catch (NumberFormatException e) {
                    throw new TreeReadException("Expected a float but found " + f, start);
                }
            case BOOL:
                String b = readAtom();
                if (b.equals("true")) {
                    return Boolean.TRUE;
                } else if (b.equals("false")) {
                    return Boolean.FALSE;
                }
                throw new TreeReadException("Expected true or false but found " + b, start);
            case TRIVIA:
                return readTrivia();
            default:
                throw new TreeReadException("Unsupported type " + s.getType(), start);
        }
    }

    private Trivia readTrivia() {
        expect('(');
        int start = pos;
        String tag = readAtom();
        if (!tag.equals("Trivia")) {
            throw new TreeReadException("Expected Trivia but found " + tag, start);
        }
        List<TriviaItem> inside = readItems();
        List<TriviaItem> after = readItems();
        expect(')');
        try {
            return Trivia.of(inside, after);
        } catch (IllegalArgumentException e) {
            throw new TreeReadException(e.getMessage(), start);
        }
    }

    private List<TriviaItem> readItems() {
        expect('[');
        List<TriviaItem> items = Lists.newArrayList();
        while (peek() != ']') {
            expect('(');
            int start = pos;
            String tag = readAtom();
            switch (tag) {
                case "EndOfLine":
                    items.add(TriviaItem.endOfLine());
                    break;
                case "Semicolon":
                    items.add(TriviaItem.semicolon());
                    break;
                case "Comment":
                    items.add(TriviaItem.comment(readString()));
                    break;
                case "EOLComment":
                    items.add(TriviaItem.eolComment(readString()));
                    break;
                default:
                    throw new TreeReadException("Unknown trivia item " + tag, start);
            }
            expect(')');
        }
        expect(']');
        return items;
    }

    private String readString() {
        skipWhitespace();
        if (pos >= text.length() || text.charAt(pos) != '"') {
            throw new TreeReadException("Expected a string", pos);
        }
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw new TreeReadException("Unterminated string", start);
            }
            char c = text.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= text.length()) {
                throw new TreeReadException("Unterminated escape", pos);
            }
            char e = text.charAt(pos++);
            switch (e) {
                case '"':
                case '\\':
                    sb.append(e);
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'u':
                    if (pos + 4 > text.length()) {
                        throw new TreeReadException("Truncated unicode escape", pos);
                    }
                    try {
                        sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                    } catch (NumberFormatException ex) {
                        throw new TreeReadException("Invalid unicode escape", pos);
                    }
                    pos += 4;
                    break;
                default:
                    throw new TreeReadException("Invalid escape \\" + e, pos - 1);
            }
        }
    }

    /** A run of characters up to whitespace, a bracket or a quote. */
    private String readAtom() {
        skipWhitespace();
        int start = pos;
        while (pos < text.length() && !isDelimiter(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw new TreeReadException("Expected a word", pos);
        }
        return text.substring(start, pos);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '[' || c == ']' || c == '"';
    }

    private void expect(char c) {
        skipWhitespace();
        if (pos >= text.length()) {
            throw new TreeReadException("Expected '" + c + "' but reached the end", pos);
        }
        if (text.charAt(pos) != c) {
            throw new TreeReadException("Expected '" + c + "' but found '" + text.charAt(pos) + "'", pos);
        }
        pos++;
    }

    private char peek() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw new TreeReadException("Unexpected end of input", pos);
        }
        return text.charAt(pos);
    }

    private char peekAfterParen() {
        int p = pos + 1;
        while (p < text.length() && Character.isWhitespace(text.charAt(p))) {
            p++;
        }
        return p < text.length() ? text.charAt(p) : 0;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
