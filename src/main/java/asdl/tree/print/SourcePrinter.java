package asdl.tree.print;

import java.util.List;

import asdl.schema.BuiltinType;
import asdl.schema.Slot;
import asdl.tree.Handle;
import asdl.tree.Node;
import asdl.tree.Tree;
import asdl.tree.Trivia.LineState;
import asdl.tree.TriviaItem;
import asdl.tree.TriviaKind;
import asdl.tree.visit.Walker;

/**
 * Renders trees as source text through {@link PrintTemplates}.
 * <p>
 * Statements are nodes printed through a {@code {>f}} or {@code {=f}}
 * placeholder, and the root. A statement starts on a fresh line at its block's indentation,
 * or on the same line after a semicolon, and ends with its after trivia
 * or a line end. Comments are indented like the statements they precede.
 * <p>
 * Trivia that cannot be printed faithfully is rejected with
 * {@link IllegalArgumentException}: inside trivia of a node whose
 * template neither has {@code {#inside}} nor opens a block on an open
 * line, and trivia that would have to end a line its template already
 * ended. A leading line end in trivia after such a template is the line
 * end the template wrote.
 */
public final class SourcePrinter {
    private final PrintTemplates templates;

    public SourcePrinter(PrintTemplates templates) {
        this.templates = templates;
    }

    public PrintTemplates getTemplates() {
        return templates;
    }

    public String print(Tree tree) {
        return print(tree.root());
    }

    /** Prints {@code node} as a top-level statement. */
    public String print(Node node) {
        Run run = new Run();
        run.statement(node, 0);
        return run.out.toString();
    }

    /** Prints {@code node} inline, without a line end. */
    public String printExpression(Node node) {
        Run run = new Run();
        run.walker.walk(node);
        return run.out.toString();
    }

    /**
     * Output state of one print call. All output is written by actions
     * handed to the walker, so it comes out in template order however
     * deep the tree is.
     */
    private final class Run {
        final StringBuilder out = new StringBuilder();
        final Walker walker;
        LineState line = LineState.CLOSED;
        int depth = 0;

        Run() {
            walker = Walker.builder(templates.getGrammar())
                    .otherwise((w, n) -> render(n))
                    .build();
        }

        void statement(Node node, int statementDepth) {
            int saved = depth;
            walker.then(() -> {
                depth = statementDepth;
                if (line == LineState.OPEN) {
                    out.append('\n');
                    line = LineState.CLOSED;
                }
            });
            // indentation or the space after a semicolon is written with the first text
            walker.walk(node);
            walker.then(() -> {
                trivia(node, node.trivia().getAfter(), depth);
                depth = saved;
            });
        }

        private void render(Node node) {
            boolean[] insideDone = {false};
            for (PrintTemplates.Segment s : templates.template(node.kind())) {
                walker.then(() -> segment(node, s, insideDone));
            }
            walker.then(() -> {
                if (!insideDone[0] && !node.trivia().getInside().isEmpty()) {
                    throw new IllegalArgumentException("The template of " + node.kind().getName()
                            + " has no place for the inside trivia of " + node);
                }
            });
        }

        private void segment(Node node, PrintTemplates.Segment s, boolean[] insideDone) {
            switch (s.kind) {
                case LITERAL:
                    text(s.text);
                    break;
                case FIELD:
                    Object v = node.get(s.slot.getIndex());
                    if (v == null) {
                        break;
                    }
                    if (s.slot.isSequence()) {
                        joined(node, s.slot, (List<?>) v, ", ");
                    } else {
                        value(node, s.slot, v);
                    }
                    break;
                case JOIN:
                    joined(node, s.slot, (List<?>) node.get(s.slot.getIndex()), s.text);
                    break;
                case OPTIONAL:
                    Object o = node.get(s.slot.getIndex());
                    if (o != null) {
                        text(s.text);
                        value(node, s.slot, o);
                    }
                    break;
                case INSIDE:
                    trivia(node, node.trivia().getInside(), depth + 1);
                    insideDone[0] = true;
                    break;
                case BLOCK:
                case LINES:
                    if (line == LineState.OPEN && !insideDone[0]) {
                        trivia(node, node.trivia().getInside(), depth + 1);
                        insideDone[0] = true;
                    }
                    block(node, s.slot, s.kind == PrintTemplates.SegmentKind.BLOCK ? depth + 1 : depth);
                    break;
            }
        }

        private void block(Node node, Slot slot, int blockDepth) {
            Object v = node.get(slot.getIndex());
            if (v == null) {
                return;
            }
            if (slot.isSequence()) {
                for (Object h : (List<?>) v) {
                    statement(node.arena().node((Handle) h), blockDepth);
                }
            } else {
                statement(node.arena().node((Handle) v), blockDepth);
            }
        }

        private void joined(Node node, Slot slot, List<?> elements, String separator) {
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    walker.then(() -> text(separator));
                }
                value(node, slot, elements.get(i));
            }
        }

        private void value(Node node, Slot slot, Object v) {
            if (slot.isNode()) {
                walker.walk(node.arena().node((Handle) v));
                return;
            }
            String literal;
            switch ((BuiltinType) slot.getType()) {
                case STRING:
                    literal = "\"" + ((String) v).replace("\"", "\"\"") + "\"";
                    break;
                default:
                    literal = String.valueOf(v);
            }
            walker.then(() -> text(literal));
        }

        /** Literal text; may contain line breaks, after which indentation is restored. */
        private void text(String s) {
            int start = 0;
            while (start <= s.length()) {
                int nl = s.indexOf('\n', start);
                String piece = nl < 0 ? s.substring(start) : s.substring(start, nl);
                if (!piece.isEmpty()) {
                    if (line == LineState.CLOSED) {
                        appendIndent(depth);
                    } else if (line == LineState.SEPARATED) {
                        out.append(' ');
                    }
                    out.append(piece);
                    line = LineState.OPEN;
                }
                if (nl < 0) {
                    break;
                }
                out.append('\n');
                line = LineState.CLOSED;
                start = nl + 1;
            }
        }

        private void trivia(Node owner, List<TriviaItem> items, int commentDepth) {
            if (items.isEmpty()) {
                // implicit line end, unless a trailing block already ended the line
                if (line != LineState.CLOSED) {
                    out.append('\n');
                    line = LineState.CLOSED;
                }
                return;
            }
            List<TriviaItem> rest = items;
            if (line == LineState.CLOSED) {
                // the template already ended the line: a leading line end is that one
                TriviaKind first = items.get(0).getKind();
                if (first != TriviaKind.END_OF_LINE) {
                    throw new IllegalArgumentException("Trivia of " + owner + " starts with " + first
                            + " but " + owner.kind().getName() + " already ended its line");
                }
                rest = items.subList(1, items.size());
            }
            for (TriviaItem item : rest) {
                switch (item.getKind()) {
                    case END_OF_LINE:
                        out.append('\n');
                        line = LineState.CLOSED;
                        break;
                    case SEMICOLON:
                        out.append(';');
                        line = LineState.SEPARATED;
                        break;
                    case EOL_COMMENT:
                        out.append(' ').append(templates.getCommentPrefix()).append(item.getText()).append('\n');
                        line = LineState.CLOSED;
                        break;
                    case COMMENT:
                        appendIndent(commentDepth);
                        out.append(templates.getCommentPrefix()).append(item.getText()).append('\n');
                        line = LineState.CLOSED;
                        break;
                }
            }
        }

        private void appendIndent(int n) {
            for (int i = 0; i < n; i++) {
                out.append(templates.getIndent());
            }
        }
    }
}
