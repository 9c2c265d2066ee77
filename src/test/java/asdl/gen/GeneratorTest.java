package asdl.gen;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import org.antlr.v4.runtime.CharStream;
import org.apache.log4j.Logger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import asdl.ToySchema;
import asdl.schema.Grammar;
import asdl.schema.Schemas;
import asdl.tree.Arena;

import com.google.common.collect.ImmutableList;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class GeneratorTest {

    @TempDir
    Path tmp;

    private FileGenerator generate(String schemaText, String packageName, String prefix, String factory)
            throws Exception {
        Grammar grammar = Schemas.load(schemaText, "test.asdl");
        Path out = tmp.resolve("src").resolve(packageName.replace('.', '/'));
        FileGenerator files = new FileGenerator(out.toFile());
        new Generator(files, grammar, new GeneratorOptions(packageName, prefix, factory), schemaText).generate();
        return files;
    }

    private FileGenerator generateToy(String packageName) throws Exception {
        String text = new String(Files.readAllBytes(ToySchema.FILE), StandardCharsets.UTF_8);
        return generate(text, packageName, "Toy", "Toy");
    }

    @Test
    public void oneFilePerTypeAndConstructor() throws Exception {
        FileGenerator files = generateToy("gen.toy");
        List<String> names = files.getWrittenFiles().stream().map(File::getName).sorted()
                .collect(Collectors.toList());
        assertEquals(List.of("Toy.java", "ToyAdd.java", "ToyAssign.java", "ToyBinOp.java", "ToyBlock.java",
                "ToyCall.java", "ToyElement.java", "ToyExpr.java", "ToyIf.java", "ToyMul.java", "ToyName.java",
                "ToyNum.java", "ToyOperator.java", "ToyParen.java", "ToyPrint.java", "ToyStmt.java",
                "ToyStr.java", "ToySub.java"), names);
        for (File f : files.getWrittenFiles()) {
            String first = Files.readAllLines(f.toPath(), StandardCharsets.UTF_8).get(0);
            assertEquals("// Generated by asdl-gen from test.asdl. Do not edit.", first);
        }
        assertEquals(names.size(), files.getChangedCount());
    }

    @Test
    public void generatedSourcesMentionEveryConstructor() throws Exception {
        generateToy("gen.toy");
        Path dir = tmp.resolve("src/gen/toy");
        String factory = new String(Files.readAllBytes(dir.resolve("Toy.java")), StandardCharsets.UTF_8);
        assertTrue(factory.contains("public static final int TAG_BIN_OP = 8;"), factory);
        assertTrue(factory.contains("public static ToyAssign Assign(Arena arena, String target, ToyExpr value, Trivia trivia)"));
        assertTrue(factory.contains("public static ToyNum Num(Arena arena, Location location, long n)"));
        String element = new String(Files.readAllBytes(dir.resolve("ToyElement.java")), StandardCharsets.UTF_8);
        assertTrue(element.contains("public sealed interface ToyElement permits ToyBlock, ToyStmt, ToyExpr, ToyOperator {"));
        assertTrue(element.contains("R visitBinOp(ToyBinOp n);"));
        String stmt = new String(Files.readAllBytes(dir.resolve("ToyStmt.java")), StandardCharsets.UTF_8);
        assertTrue(stmt.contains("T case_Call(ToyCall n);"));
    }

    @Test
    public void regeneratingChangesNothing() throws Exception {
        generateToy("gen.toy");
        FileGenerator again = generateToy("gen.toy");
        assertEquals(0, again.getChangedCount());
    }

    @Test
    public void collidingNamesAreRejected() {
        assertCollision("module M { a = X | Y  x = (int n) }", "");
        assertCollision("module M { e = BinOp | Bin_Op }", "P");
        assertCollision("module M { t = (int location) }", "P");
        assertCollision("module M { t = (int a, int A) }", "P");
        assertCollision("module M { t = (int arena, int arena_) }", "P");
        assertCollision("module M { e = List | Other }", "");
        assertCollision("module M { view = (int n) }", "P");
        assertCollision("module M { e = A  element = (int n) }", "");
        assertCollision("module M { t = (int class) }", "P");
    }

    private void assertCollision(String schema, String prefix) {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> generate(schema, "gen.bad", prefix, "Factory"), schema);
        assertTrue(e.getMessage().startsWith("Cannot generate Java sources for M"), e.getMessage());
    }

    @Test
    public void generatedToySourcesCompile() throws Exception {
        generateToy("gen.toy");
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        assertTrue(compile(diagnostics), diagnostics.getDiagnostics().toString());
    }

    @Test
    public void incompleteVisitorDoesNotCompile() throws Exception {
        generateToy("gen.toy");
        Files.write(tmp.resolve("src/gen/toy/Incomplete.java"), List.of(
                "package gen.toy;",
                "class Incomplete implements ToyElement.Visitor<String> {",
                "    @Override public String visitAssign(ToyAssign n) {",
                "        return n.getTarget();",
                "    }",
                "}"), StandardCharsets.UTF_8);
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        assertFalse(compile(diagnostics));
        assertTrue(diagnostics.getDiagnostics().stream()
                .anyMatch(d -> d.getSource() != null && d.getSource().getName().endsWith("Incomplete.java")));
    }

    @Test
    public void attributesAndOptionalsCompile() throws Exception {
        generate("module Calc {\n"
                + "  expr = Num(int n) | Neg(expr e) | Lit(string? text, float* parts, bool flag)\n"
                + "         attributes (int line, identifier? file)\n"
                + "  stmt = S(expr* es, expr? cond, trivia? t) | Default(int default)\n"
                + "  unit = (stmt* body, stmt main)\n"
                + "}\n", "gen.calc", "C", "CalcAst");
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        assertTrue(compile(diagnostics), diagnostics.getDiagnostics().toString());
    }

    private boolean compile(DiagnosticCollector<JavaFileObject> diagnostics) throws Exception {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assumeTrue(compiler != null, "no system Java compiler");
        Path classes = Files.createDirectories(tmp.resolve("classes"));
        List<File> sources;
        try (Stream<Path> walk = Files.walk(tmp.resolve("src"))) {
            sources = walk.filter(p -> p.toString().endsWith(".java")).map(Path::toFile).collect(Collectors.toList());
        }
        try (StandardJavaFileManager fm = compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
            List<String> options = List.of("-d", classes.toString(), "-classpath", classpath(), "-proc:none");
            return compiler.getTask(null, fm, diagnostics, options, null, fm.getJavaFileObjectsFromFiles(sources))
                    .call();
        }
    }

    private static String classpath() throws Exception {
        List<String> entries = new ArrayList<>();
        for (Class<?> c : List.of(Arena.class, ImmutableList.class, CharStream.class, Logger.class)) {
            entries.add(Paths.get(c.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
        }
        return String.join(File.pathSeparator, entries);
    }
}
