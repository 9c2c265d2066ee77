package asdl.schema;

import java.util.List;
import java.util.Set;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.apache.log4j.Logger;

import asdl.ErrorListener;
import asdl.Logging;
import asdl.schema.ast.ConstructorDef;
import asdl.schema.ast.FieldDef;
import asdl.schema.ast.ModuleDef;
import asdl.schema.ast.Multiplicity;
import asdl.schema.ast.ProductDef;
import asdl.schema.ast.SumDef;
import asdl.schema.ast.TypeDef;
import asdl.schema.ast.TypeRef;
import asdl.schema.parser.AsdlLexer;
import asdl.schema.parser.AsdlParser;
import asdl.schema.parser.AsdlParser.AttributesContext;
import asdl.schema.parser.AsdlParser.ConstructorContext;
import asdl.schema.parser.AsdlParser.DefinitionContext;
import asdl.schema.parser.AsdlParser.FieldContext;
import asdl.schema.parser.AsdlParser.FieldsContext;
import asdl.schema.parser.AsdlParser.ModuleContext;
import asdl.schema.parser.AsdlParser.ProductContext;
import asdl.schema.parser.AsdlParser.SumContext;
import asdl.source.Location;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Reads ASDL source text into a {@link ModuleDef}. The reader is pure:
 * it resolves nothing and reports every syntax error it finds.
 */
public class SchemaReader {
    private static final Logger logger = Logging.getLogger();

    public static ModuleDef read(String source, String sourceName) throws SchemaSyntaxException {
        ErrorListener errListener = new ErrorListener();

        AsdlLexer lexer = new AsdlLexer(CharStreams.fromString(source, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        AsdlParser parser = new AsdlParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errListener);

        ModuleContext module = parser.module();

        if (errListener.getErrCount() > 0) {
            throw new SchemaSyntaxException(sourceName, errListener.getErrors());
        }
        ModuleDef result = translateModule(module, sourceName);
        logger.debug("read module " + result.getName() + " from " + sourceName
                + " with " + result.definitions.size() + " definitions");
        return result;
    }

    private static ModuleDef translateModule(ModuleContext ctx, String sourceName) {
        List<TypeDef> definitions = Lists.newArrayList();
        for (DefinitionContext d : ctx.definition()) {
            definitions.add(translateDefinition(d));
        }
        return new ModuleDef(ctx.id().getText(), definitions, sourceName, location(ctx));
    }

    private static TypeDef translateDefinition(DefinitionContext ctx) {
        String name = ctx.TypeId().getText();
        ProductContext product = ctx.type().product();
        if (product != null) {
            return new ProductDef(name, translateFields(product.fields()),
                    translateAttributes(product.attributes()), location(ctx));
        }
        SumContext sum = ctx.type().sum();
        List<ConstructorDef> constructors = Lists.newArrayList();
        for (ConstructorContext c : sum.constructor()) {
            List<FieldDef> fields = c.fields() == null
                    ? ImmutableList.<FieldDef>of()
                    : translateFields(c.fields());
            constructors.add(new ConstructorDef(c.ConstructorId().getText(), fields, location(c)));
        }
        return new SumDef(name, constructors, translateAttributes(sum.attributes()), location(ctx));
    }

    private static List<FieldDef> translateAttributes(AttributesContext ctx) {
        if (ctx == null) {
            return ImmutableList.of();
        }
        return translateFields(ctx.fields());
    }

    /**
     * Positional fields are named after their type; when that name is
     * taken in the same list, the 1-based position is appended.
     */
    private static List<FieldDef> translateFields(FieldsContext ctx) {
        List<FieldContext> raw = ctx.field();
        Set<String> declared = Sets.newHashSet();
        Set<String> typeNamesOfPositional = Sets.newHashSet();
        Set<String> ambiguous = Sets.newHashSet();
        for (FieldContext f : raw) {
            if (f.id() != null) {
                declared.add(f.id().getText());
            } else if (!typeNamesOfPositional.add(f.TypeId().getText())) {
                ambiguous.add(f.TypeId().getText());
            }
        }

        List<FieldDef> result = Lists.newArrayList();
        int position = 0;
        for (FieldContext f : raw) {
            position++;
            String typeName = f.TypeId().getText();
            TypeRef type = new TypeRef(typeName, location(f.TypeId().getSymbol()));
            Multiplicity multiplicity = f.cardinality == null
                    ? Multiplicity.REQUIRED
                    : Multiplicity.fromSuffix(f.cardinality.getText());
            if (f.id() != null) {
                result.add(new FieldDef(type, multiplicity, f.id().getText(), true, location(f)));
            } else {
                String name = typeName;
                if (declared.contains(name) || ambiguous.contains(name)) {
                    name = typeName + position;
                }
                result.add(new FieldDef(type, multiplicity, name, false, location(f)));
            }
        }
        return result;
    }

    static Location location(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop() == null ? start : ctx.getStop();
        int stopLength = stop.getText() == null ? 1 : Math.max(1, stop.getText().length());
        return Location.of(start.getLine(), start.getCharPositionInLine() + 1,
                stop.getLine(), stop.getCharPositionInLine() + stopLength);
    }

    static Location location(Token token) {
        int length = token.getText() == null ? 1 : Math.max(1, token.getText().length());
        return Location.of(token.getLine(), token.getCharPositionInLine() + 1,
                token.getLine(), token.getCharPositionInLine() + length);
    }
}
