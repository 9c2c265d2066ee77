package asdl.gen;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

import com.google.common.base.Preconditions;

/**
 * Where and under which names generated sources go.
 * <p>
 * Defaults derive from the module name; a {@code <schema>.properties}
 * file next to the schema (keys {@code package}, {@code prefix},
 * {@code factory}) overrides them, command line arguments override both.
 */
public final class GeneratorOptions {
    private final String packageName;
    private final String typePrefix;
    private final String factoryName;

    public GeneratorOptions(String packageName, String typePrefix, String factoryName) {
        Preconditions.checkArgument(JavaNames.isPackageName(packageName), "Invalid package name: %s", packageName);
        Preconditions.checkArgument(typePrefix.isEmpty() || JavaNames.isIdentifier(typePrefix),
                "Invalid type prefix: %s", typePrefix);
        Preconditions.checkArgument(JavaNames.isIdentifier(factoryName), "Invalid factory name: %s", factoryName);
        this.packageName = packageName;
        this.typePrefix = typePrefix;
        this.factoryName = factoryName;
    }

    public static GeneratorOptions defaults(String moduleName) {
        return new GeneratorOptions("asdl.generated." + moduleName.toLowerCase(Locale.ROOT), moduleName, moduleName);
    }

    /** Defaults for the module, overridden by the schema's sidecar file if there is one. */
    public static GeneratorOptions forSchema(String moduleName, Path schemaFile) throws IOException {
        GeneratorOptions options = defaults(moduleName);
        Path sidecar = schemaFile.resolveSibling(schemaFile.getFileName() + ".properties");
        if (Files.isRegularFile(sidecar)) {
            Properties p = new Properties();
            try (Reader r = Files.newBufferedReader(sidecar, StandardCharsets.UTF_8)) {
                p.load(r);
            }
            options = options.with(p.getProperty("package"), p.getProperty("prefix"), p.getProperty("factory"));
        }
        return options;
    }

    /** Null arguments keep the current value. */
    public GeneratorOptions with(String newPackage, String newPrefix, String newFactory) {
        return new GeneratorOptions(
                newPackage == null ? packageName : newPackage.trim(),
                newPrefix == null ? typePrefix : newPrefix.trim(),
                newFactory == null ? factoryName : newFactory.trim());
    }

    public String getPackageName() {
        return packageName;
    }

    public String getTypePrefix() {
        return typePrefix;
    }

    public String getFactoryName() {
        return factoryName;
    }

    @Override
    public String toString() {
        return "package=" + packageName + ", prefix=" + typePrefix + ", factory=" + factoryName;
    }
}
