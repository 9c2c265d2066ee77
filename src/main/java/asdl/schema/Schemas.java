package asdl.schema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;

import asdl.Logging;
import asdl.schema.ast.ModuleDef;

import com.google.common.io.ByteStreams;

/**
 * Entry points for turning ASDL text into a {@link Grammar}.
 */
public final class Schemas {
    private static final Logger logger = Logging.getLogger();

    private Schemas() {
    }

    public static ModuleDef parse(String text, String sourceName) throws SchemaSyntaxException {
        return SchemaReader.read(text, sourceName);
    }

    public static Grammar load(String text, String sourceName) throws SchemaException {
        Grammar grammar = GrammarValidator.validate(SchemaReader.read(text, sourceName));
        logger.debug("loaded " + grammar + " from " + sourceName);
        return grammar;
    }

    public static Grammar load(Path file) throws IOException, SchemaException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return load(text, file.toString());
    }

    /** Loads a schema from the class path, e.g. {@code asdl/fortran/AST.asdl}. */
    public static Grammar loadResource(String resourceName) throws IOException, SchemaException {
        ClassLoader loader = Schemas.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("Schema resource not found: " + resourceName);
            }
            return load(new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8), resourceName);
        }
    }

    /**
     * For generated factories, which embed a schema that already passed
     * validation when they were generated.
     */
    public static Grammar fromText(String text, String sourceName) {
        try {
            return load(text, sourceName);
        } catch (SchemaException e) {
            throw new IllegalStateException("Embedded schema " + sourceName + " no longer validates", e);
        }
    }
}
