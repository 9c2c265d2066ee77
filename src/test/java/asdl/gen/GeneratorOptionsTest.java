package asdl.gen;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import asdl.ToySchema;

import static org.junit.jupiter.api.Assertions.*;

public class GeneratorOptionsTest {

    @TempDir
    Path tmp;

    @Test
    public void defaultsFollowTheModuleName() {
        GeneratorOptions o = GeneratorOptions.defaults("Fortran");
        assertEquals("asdl.generated.fortran", o.getPackageName());
        assertEquals("Fortran", o.getTypePrefix());
        assertEquals("Fortran", o.getFactoryName());
    }

    @Test
    public void sidecarOverridesDefaults() throws Exception {
        GeneratorOptions o = GeneratorOptions.forSchema("Toy", ToySchema.FILE);
        assertEquals("test.toy", o.getPackageName());
        assertEquals("Toy", o.getTypePrefix());
        assertEquals("Toy", o.getFactoryName());
    }

    @Test
    public void partialSidecar() throws Exception {
        Path schema = tmp.resolve("calc.asdl");
        Files.write(schema, List.of("module Calc { e = Num(int n) }"), StandardCharsets.UTF_8);
        Files.write(tmp.resolve("calc.asdl.properties"), List.of("prefix = K"), StandardCharsets.UTF_8);
        GeneratorOptions o = GeneratorOptions.forSchema("Calc", schema);
        assertEquals("asdl.generated.calc", o.getPackageName());
        assertEquals("K", o.getTypePrefix());
        assertEquals("Calc", o.getFactoryName());
    }

    @Test
    public void noSidecar() throws Exception {
        GeneratorOptions o = GeneratorOptions.forSchema("Calc", tmp.resolve("calc.asdl"));
        assertEquals("asdl.generated.calc", o.getPackageName());
    }

    @Test
    public void withKeepsNullValues() {
        GeneratorOptions o = GeneratorOptions.defaults("M").with("a.b", null, " F ");
        assertEquals("a.b", o.getPackageName());
        assertEquals("M", o.getTypePrefix());
        assertEquals("F", o.getFactoryName());
    }

    @Test
    public void invalidNames() {
        assertThrows(IllegalArgumentException.class, () -> new GeneratorOptions("a..b", "P", "F"));
        assertThrows(IllegalArgumentException.class, () -> new GeneratorOptions("a.class", "P", "F"));
        assertThrows(IllegalArgumentException.class, () -> new GeneratorOptions("a", "1P", "F"));
        assertThrows(IllegalArgumentException.class, () -> new GeneratorOptions("a", "P", "new"));
        assertEquals("", new GeneratorOptions("a", "", "F").getTypePrefix());
    }
}
