package asdl.tree.print;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import asdl.schema.Grammar;
import asdl.schema.NodeKind;
import asdl.schema.Slot;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * One source template per constructor, loaded from a properties file:
 *
 * <pre>
 * &#64;indent = 2
 * &#64;comment = !
 * If = IF {test} THEN{#inside}{>body}END IF
 * Assign = {target} = {value}
 * </pre>
 *
 * Placeholders: {@code {f}} prints a field (sequences joined with ", "),
 * {@code {f|sep}} joins a sequence with {@code sep}, {@code {f?prefix}}
 * prints an optional field after {@code prefix} when present,
 * {@code {>f}} prints statements as an indented block on their own lines,
 * {@code {=f}} prints them on their own lines without indenting, and
 * {@code {#inside}} ends the header line with the node's inside
 * trivia. Doubled braces stand for literal braces.
 */
public final class PrintTemplates {
    static final String INDENT_KEY = "@indent";
    static final String COMMENT_KEY = "@comment";

    enum SegmentKind {
        LITERAL, FIELD, JOIN, OPTIONAL, BLOCK, LINES, INSIDE
    }

    static final class Segment {
        final SegmentKind kind;
        /** literal text, separator or prefix */
        final String text;
        final Slot slot;

        Segment(SegmentKind kind, String text, Slot slot) {
            this.kind = kind;
            this.text = text;
            this.slot = slot;
        }
    }

    private final Grammar grammar;
    private final ImmutableList<ImmutableList<Segment>> templates;
    private final String indent;
    private final String commentPrefix;

    private PrintTemplates(Grammar grammar, ImmutableList<ImmutableList<Segment>> templates, String indent,
            String commentPrefix) {
        this.grammar = grammar;
        this.templates = templates;
        this.indent = indent;
        this.commentPrefix = commentPrefix;
    }

    public static PrintTemplates load(Grammar grammar, Reader reader) throws IOException {
        Properties p = new Properties();
        p.load(reader);
        return of(grammar, p);
    }

    public static PrintTemplates loadResource(Grammar grammar, String resourceName) throws IOException {
        try (InputStream in = PrintTemplates.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Print templates not found: " + resourceName);
            }
            return load(grammar, new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    /**
     * @throws IllegalArgumentException for missing constructors, unknown
     *         keys or malformed templates; all problems are reported together
     */
    public static PrintTemplates of(Grammar grammar, Properties p) {
        List<String> problems = Lists.newArrayList();
        Set<String> keys = Sets.newTreeSet(p.stringPropertyNames());

        int indentWidth = 2;
        String indentValue = p.getProperty(INDENT_KEY);
        if (indentValue != null) {
            try {
                indentWidth = Integer.parseInt(indentValue.trim());
                if (indentWidth < 0) {
                    problems.add(INDENT_KEY + " must not be negative");
                }
            } catch (NumberFormatException e) {
                problems.add(INDENT_KEY + " is not a number: " + indentValue);
            }
        }
        String comment = p.getProperty(COMMENT_KEY, "!");
        keys.remove(INDENT_KEY);
        keys.remove(COMMENT_KEY);

        ImmutableList.Builder<ImmutableList<Segment>> templates = ImmutableList.builder();
        for (NodeKind k : grammar.getKinds()) {
            String template = p.getProperty(k.getName());
            keys.remove(k.getName());
            if (template == null) {
                problems.add("no template for " + k.getName());
                templates.add(ImmutableList.of());
                continue;
            }
            templates.add(parse(k, template, problems));
        }
        for (String unknown : keys) {
            problems.add("unknown key " + unknown);
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid print templates for " + grammar.getName() + ": "
                    + String.join("; ", problems));
        }
        return new PrintTemplates(grammar, templates.build(), Strings.repeat(" ", indentWidth), comment);
    }

    private static ImmutableList<Segment> parse(NodeKind kind, String template, List<String> problems) {
        ImmutableList.Builder<Segment> segments = ImmutableList.builder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
            } else if (c == '}') {
                problems.add(kind.getName() + ": unmatched '}' at " + i);
                i++;
            } else if (c == '{') {
                int end = template.indexOf('}', i);
                if (end < 0) {
                    problems.add(kind.getName() + ": unclosed '{' at " + i);
                    break;
                }
                if (literal.length() > 0) {
                    segments.add(new Segment(SegmentKind.LITERAL, literal.toString(), null));
                    literal.setLength(0);
                }
                Segment s = placeholder(kind, template.substring(i + 1, end), problems);
                if (s != null) {
                    segments.add(s);
                }
                i = end + 1;
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            segments.add(new Segment(SegmentKind.LITERAL, literal.toString(), null));
        }
        return segments.build();
    }

    private static Segment placeholder(NodeKind kind, String body, List<String> problems) {
        if (body.equals("#inside")) {
            return new Segment(SegmentKind.INSIDE, "", null);
        }
        SegmentKind segmentKind = SegmentKind.FIELD;
        String name = body;
        String text = "";
        if (body.startsWith(">")) {
            segmentKind = SegmentKind.BLOCK;
            name = body.substring(1);
        } else if (body.startsWith("=")) {
            segmentKind = SegmentKind.LINES;
            name = body.substring(1);
        } else if (body.indexOf('|') >= 0) {
            segmentKind = SegmentKind.JOIN;
            name = body.substring(0, body.indexOf('|'));
            text = body.substring(body.indexOf('|') + 1);
        } else if (body.indexOf('?') >= 0) {
            segmentKind = SegmentKind.OPTIONAL;
            name = body.substring(0, body.indexOf('?'));
            text = body.substring(body.indexOf('?') + 1);
        }
        if (!kind.hasSlot(name)) {
            problems.add(kind.getName() + ": no field " + name + " in {" + body + "}");
            return null;
        }
        Slot slot = kind.getSlot(name);
        if (slot.isTrivia()) {
            problems.add(kind.getName() + ": trivia field " + name + " cannot be printed directly");
            return null;
        }
        if (segmentKind == SegmentKind.JOIN && !slot.isSequence()) {
            problems.add(kind.getName() + ": {" + body + "} needs a sequence field");
            return null;
        }
        if (segmentKind == SegmentKind.OPTIONAL && !slot.isOptional()) {
            problems.add(kind.getName() + ": {" + body + "} needs an optional field");
            return null;
        }
        if ((segmentKind == SegmentKind.BLOCK || segmentKind == SegmentKind.LINES) && !slot.isNode()) {
            problems.add(kind.getName() + ": {" + body + "} needs a node field");
            return null;
        }
        return new Segment(segmentKind, text, slot);
    }

    public Grammar getGrammar() {
        return grammar;
    }

    ImmutableList<Segment> template(NodeKind kind) {
        return templates.get(kind.getTag());
    }

    public String getIndent() {
        return indent;
    }

    public String getCommentPrefix() {
        return commentPrefix;
    }
}
