package asdl.tree.print;

import java.util.List;

import asdl.schema.Grammar;
import asdl.source.Location;
import asdl.tree.Arena;
import asdl.tree.Handle;
import asdl.tree.Tree;
import asdl.tree.Trivia;
import asdl.tree.Trivia.LineState;
import asdl.tree.TriviaItem;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Reads the toy language as printed with asdl/toy.print. Comments and
 * blank lines are attached to the statement they follow; a trivia
 * sequence that is only a line end is stored as absent.
 */
final class ToyParser implements SourceParser {
    private final Grammar grammar;

    ToyParser(Grammar grammar) {
        this.grammar = grammar;
    }

    @Override
    public Tree parse(String source) {
        return new Run(source).program();
    }

    private final class Run {
        private final String text;
        private final Arena arena = new Arena(grammar);
        private int pos = 0;

        Run(String text) {
            this.text = text;
        }

        Tree program() {
            List<Handle> body = statements(false);
            if (pos < text.length()) {
                throw error("unexpected text");
            }
            Handle root = arena.allocate("block", Location.at(1, 1), body, null);
            arena.freeze();
            return new Tree(arena, root);
        }

        private List<Handle> statements(boolean inIf) {
            List<Handle> result = Lists.newArrayList();
            while (true) {
                skipSpaces();
                if (pos >= text.length() || (inIf && lookingAt("END IF"))) {
                    return result;
                }
                result.add(statement());
            }
        }

        private Handle statement() {
            Location loc = location(pos);
            if (lookingAt("IF ")) {
                consume("IF ");
                Handle test = expr();
                consume(" THEN");
                List<TriviaItem> inside = trivia();
                List<Handle> body = statements(true);
                consume("END IF");
                return arena.allocate("If", loc, test, body, triviaOf(inside, trivia()));
            }
            if (lookingAt("PRINT ")) {
                consume("PRINT ");
                List<Handle> values = exprList();
                return arena.allocate("Print", loc, values, triviaOf(ImmutableList.of(), trivia()));
            }
            if (lookingAt("CALL ")) {
                consume("CALL ");
                String name = identifier();
                consume("(");
                List<Handle> args = lookingAt(")") ? ImmutableList.of() : exprList();
                consume(")");
                Handle mask = null;
                if (lookingAt(" WHERE ")) {
                    consume(" WHERE ");
                    mask = expr();
                }
                return arena.allocate("Call", loc, name, args, mask, triviaOf(ImmutableList.of(), trivia()));
            }
            String target = identifier();
            consume(" = ");
            Handle value = expr();
            return arena.allocate("Assign", loc, target, value, triviaOf(ImmutableList.of(), trivia()));
        }

        private List<Handle> exprList() {
            List<Handle> values = Lists.newArrayList(expr());
            while (lookingAt(", ")) {
                consume(", ");
                values.add(expr());
            }
            return values;
        }

        private Handle expr() {
            Handle left = primary();
            while (true) {
                Location loc = location(pos);
                String op;
                if (lookingAt(" + ")) {
                    op = "Add";
                } else if (lookingAt(" - ")) {
                    op = "Sub";
                } else if (lookingAt(" * ")) {
                    op = "Mul";
                } else {
                    return left;
                }
                pos += 3;
                Handle operator = arena.allocate(op, loc);
                left = arena.allocate("BinOp", loc, left, operator, primary());
            }
        }

        private Handle primary() {
            Location loc = location(pos);
            if (pos >= text.length()) {
                throw error("expression expected");
            }
            char c = text.charAt(pos);
            if (c == '(') {
                pos++;
                Handle inner = expr();
                consume(")");
                return arena.allocate("Paren", loc, inner);
            }
            if (Character.isDigit(c)) {
                int start = pos;
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
                return arena.allocate("Num", loc, Long.parseLong(text.substring(start, pos)));
            }
            if (c == '"') {
                pos++;
                StringBuilder sb = new StringBuilder();
                while (true) {
                    if (pos >= text.length()) {
                        throw error("unterminated string");
                    }
                    char s = text.charAt(pos++);
                    if (s == '"') {
                        if (pos < text.length() && text.charAt(pos) == '"') {
                            sb.append('"');
                            pos++;
                        } else {
                            break;
                        }
                    } else {
                        sb.append(s);
                    }
                }
                return arena.allocate("Str", loc, sb.toString());
            }
            return arena.allocate("Name", loc, identifier());
        }

        private String identifier() {
            int start = pos;
            while (pos < text.length()
                    && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            if (start == pos) {
                throw error("identifier expected");
            }
            return text.substring(start, pos);
        }

        /** Greedily reads the trivia following a statement (or an IF header). */
        private List<TriviaItem> trivia() {
            List<TriviaItem> items = Lists.newArrayList();
            LineState state = LineState.OPEN;
            while (pos < text.length()) {
                if (state != LineState.CLOSED) {
                    if (state == LineState.OPEN && lookingAt(";")) {
                        pos++;
                        items.add(TriviaItem.semicolon());
                        state = LineState.SEPARATED;
                    } else if (lookingAt(" !")) {
                        pos += 2;
                        items.add(TriviaItem.eolComment(restOfLine()));
                        state = LineState.CLOSED;
                    } else if (lookingAt("\n")) {
                        pos++;
                        items.add(TriviaItem.endOfLine());
                        state = LineState.CLOSED;
                    } else {
                        break;
                    }
                } else {
                    int lineStart = pos;
                    skipSpaces();
                    if (lookingAt("!")) {
                        pos++;
                        items.add(TriviaItem.comment(restOfLine()));
                    } else if (lookingAt("\n")) {
                        pos++;
                        items.add(TriviaItem.endOfLine());
                    } else {
                        pos = lineStart;
                        break;
                    }
                }
            }
            if (items.size() == 1 && items.get(0).equals(TriviaItem.endOfLine())) {
                return ImmutableList.of();
            }
            return items;
        }

        private Trivia triviaOf(List<TriviaItem> inside, List<TriviaItem> after) {
            if (inside.isEmpty() && after.isEmpty()) {
                return null;
            }
            return Trivia.of(inside, after);
        }

        /** Text up to the line end, which is consumed. */
        private String restOfLine() {
            int nl = text.indexOf('\n', pos);
            int end = nl < 0 ? text.length() : nl;
            String result = text.substring(pos, end);
            pos = nl < 0 ? end : nl + 1;
            return result;
        }

        private void skipSpaces() {
            while (pos < text.length() && text.charAt(pos) == ' ') {
                pos++;
            }
        }

        private boolean lookingAt(String s) {
            return text.startsWith(s, pos);
        }

        private void consume(String s) {
            if (!lookingAt(s)) {
                throw error("expected '" + s + "'");
            }
            pos += s.length();
        }

        private Location location(int offset) {
            int line = 1;
            int col = 1;
            for (int i = 0; i < offset && i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    col = 1;
                } else {
                    col++;
                }
            }
            return Location.at(line, col);
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(location(pos) + ": " + message);
        }
    }
}
