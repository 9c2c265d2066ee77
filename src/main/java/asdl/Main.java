package asdl;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.log4j.Logger;

import asdl.gen.FileGenerator;
import asdl.gen.Generator;
import asdl.gen.GeneratorOptions;
import asdl.schema.Diagnostic;
import asdl.schema.Grammar;
import asdl.schema.SchemaException;
import asdl.schema.Schemas;

public class Main {
    public static final int OK = 0;
    public static final int SCHEMA_ERROR = 1;
    public static final int USAGE_ERROR = 2;
    public static final int IO_ERROR = 3;

    private static final Logger logger = Logging.getLogger();

    /**
     * @param args schema file, output folder, and optionally package,
     *             type prefix and factory name
     */
    public static void main(String[] args) {
        Logging.setupConsole();
        int code = run(args);
        if (code != OK) {
            System.exit(code);
        }
    }

    public static int run(String[] args) {
        if (args.length < 2 || args.length > 5) {
            System.err.println("usage: asdl.Main <schema.asdl> <outputFolder> [package [prefix [factory]]]");
            System.err.println("parameter 1: input file");
            System.err.println("parameter 2: output folder");
            return USAGE_ERROR;
        }
        Path inputFile = Paths.get(args[0]);
        String outputFolder = args[1];
        try {
            String text = new String(Files.readAllBytes(inputFile), StandardCharsets.UTF_8);
            Grammar grammar = Schemas.load(text, inputFile.toString());

            GeneratorOptions options = GeneratorOptions.forSchema(grammar.getName(), inputFile)
                    .with(arg(args, 2), arg(args, 3), arg(args, 4));
            logger.debug("generating " + grammar + " with " + options);

            File out = new File(outputFolder, options.getPackageName().replace('.', '/') + '/');
            FileGenerator fileGenerator = new FileGenerator(out);
            new Generator(fileGenerator, grammar, options, text).generate();
            fileGenerator.removeOldFiles();
            return OK;
        } catch (SchemaException e) {
            for (Diagnostic d : e.getDiagnostics()) {
                logger.error(e.getSourceName() + ":" + d);
            }
            return SCHEMA_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            // invalid options or Java name collisions
            logger.error(e.getMessage());
            return SCHEMA_ERROR;
        } catch (IOException | UncheckedIOException e) {
            logger.error("I/O error: " + e.getMessage(), e);
            return IO_ERROR;
        }
    }

    private static String arg(String[] args, int i) {
        return i < args.length ? args[i] : null;
    }
}
