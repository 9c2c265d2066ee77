package asdl.schema;

import org.junit.jupiter.api.Test;

import asdl.schema.ast.FieldDef;
import asdl.schema.ast.ModuleDef;
import asdl.schema.ast.Multiplicity;
import asdl.schema.ast.ProductDef;
import asdl.schema.ast.SumDef;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaReaderTest {

    @Test
    public void readsSumsProductsAndAttributes() throws Exception {
        ModuleDef m = SchemaReader.read(
                "-- comment\n"
                        + "module Calc {\n"
                        + "  expr = Num(int n) | Neg(expr e) attributes (int line)\n"
                        + "  pair = (expr left, expr? right, expr* rest)\n"
                        + "}\n", "calc.asdl");
        assertEquals("Calc", m.getName());
        assertEquals("calc.asdl", m.getSourceName());
        assertEquals(2, m.definitions.size());

        SumDef expr = (SumDef) m.definitions.get(0);
        assertEquals("expr", expr.getName());
        assertEquals(2, expr.constructors.size());
        assertEquals("Neg", expr.constructors.get(1).getName());
        assertEquals(1, expr.attributes.size());
        assertEquals("line", expr.attributes.get(0).getName());

        ProductDef pair = (ProductDef) m.definitions.get(1);
        assertFalse(pair.isSum());
        assertEquals(Multiplicity.REQUIRED, pair.fields.get(0).getMultiplicity());
        assertEquals(Multiplicity.OPTIONAL, pair.fields.get(1).getMultiplicity());
        assertEquals(Multiplicity.SEQUENCE, pair.fields.get(2).getMultiplicity());
        assertEquals(1, pair.getConstructors().size());
        assertEquals("pair", pair.getConstructors().get(0).getName());
    }

    @Test
    public void constructorsWithoutFields() throws Exception {
        ModuleDef m = SchemaReader.read("module M { op = Add | Sub }", "m");
        SumDef op = (SumDef) m.definitions.get(0);
        assertTrue(op.isSimple());
        assertTrue(op.constructors.get(0).fields.isEmpty());
    }

    @Test
    public void positionalFieldsAreNamedAfterTheirType() throws Exception {
        ModuleDef m = SchemaReader.read("module M { e = Bin(e, op, e) op = Plus }", "m");
        SumDef e = (SumDef) m.definitions.get(0);
        var fields = e.constructors.get(0).fields;
        assertEquals("e1", fields.get(0).getName());
        assertEquals("op", fields.get(1).getName());
        assertEquals("e3", fields.get(2).getName());
        for (FieldDef f : fields) {
            assertFalse(f.isNamed());
        }
    }

    @Test
    public void locationsPointIntoTheText() throws Exception {
        ModuleDef m = SchemaReader.read("module M {\n  t = (int x)\n}", "m");
        assertEquals(2, m.definitions.get(0).getLocation().getStart().line);
    }

    @Test
    public void syntaxErrorsAreCollected() {
        SchemaSyntaxException e = assertThrows(SchemaSyntaxException.class,
                () -> SchemaReader.read("module M { t = (int x y z) u = | }", "broken.asdl"));
        assertEquals("broken.asdl", e.getSourceName());
        assertFalse(e.getDiagnostics().isEmpty());
        for (Diagnostic d : e.getDiagnostics()) {
            assertEquals(DiagnosticKind.SCHEMA_SYNTAX, d.getKind());
            assertTrue(d.getLocation().isKnown());
        }
    }

    @Test
    public void missingModuleKeyword() {
        assertThrows(SchemaSyntaxException.class, () -> SchemaReader.read("M { }", "m"));
    }

    @Test
    public void moduleNeedsADefinition() {
        SchemaSyntaxException e = assertThrows(SchemaSyntaxException.class,
                () -> SchemaReader.read("module M { }", "m"));
        assertEquals(DiagnosticKind.SCHEMA_SYNTAX, e.getDiagnostics().get(0).getKind());
    }
}
