package io.surfworks.shaderforge.codegen;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Options controlling the generated text.
 *
 * <p>Values come from a single source: the file named by the CLI's
 * {@code --config} option, else {@code ~/.config/shaderforge/compiler.json},
 * else the defaults. Fields missing from a file take their default.
 *
 * @param versionDirective value of a leading {@code #version} line, or null to omit it
 * @param floatPrecision   default float precision of fragment shaders ("lowp", "mediump", "highp")
 * @param temporaryPrefix  prefix of generated temporary names
 * @param indent           one level of indentation
 */
public record CompilerConfig(
        String versionDirective,
        String floatPrecision,
        String temporaryPrefix,
        String indent
) {

    /** Default fragment float precision */
    public static final String DEFAULT_FLOAT_PRECISION = "mediump";

    /** Default temporary prefix */
    public static final String DEFAULT_TEMPORARY_PREFIX = "t";

    /** Default indentation */
    public static final String DEFAULT_INDENT = "  ";

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "shaderforge"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "compiler.json";

    private static final Set<String> PRECISIONS = Set.of("lowp", "mediump", "highp");
    private static final Pattern IDENTIFIER_START = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern VERSION = Pattern.compile("[0-9]+( es)?");

    public CompilerConfig {
        Objects.requireNonNull(floatPrecision, "floatPrecision cannot be null");
        Objects.requireNonNull(temporaryPrefix, "temporaryPrefix cannot be null");
        Objects.requireNonNull(indent, "indent cannot be null");

        if (!PRECISIONS.contains(floatPrecision)) {
            throw new IllegalArgumentException("floatPrecision must be lowp, mediump or highp, got " + floatPrecision);
        }
        if (!IDENTIFIER_START.matcher(temporaryPrefix).matches()
                || temporaryPrefix.startsWith("gl_") || temporaryPrefix.contains("__")) {
            throw new IllegalArgumentException("temporaryPrefix is not a usable identifier prefix: " + temporaryPrefix);
        }
        if (!indent.isEmpty() && !indent.isBlank()) {
            throw new IllegalArgumentException("indent must be whitespace");
        }
        if (versionDirective != null && !VERSION.matcher(versionDirective).matches()) {
            throw new IllegalArgumentException("versionDirective must look like \"100\", got " + versionDirective);
        }
    }

    /**
     * Returns the default configuration.
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(null, DEFAULT_FLOAT_PRECISION, DEFAULT_TEMPORARY_PREFIX, DEFAULT_INDENT);
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public CompilerConfig withVersionDirective(String version) {
        return new CompilerConfig(version, floatPrecision, temporaryPrefix, indent);
    }

    public CompilerConfig withFloatPrecision(String precision) {
        return new CompilerConfig(versionDirective, precision, temporaryPrefix, indent);
    }

    public CompilerConfig withTemporaryPrefix(String prefix) {
        return new CompilerConfig(versionDirective, floatPrecision, prefix, indent);
    }

    public CompilerConfig withIndent(String newIndent) {
        return new CompilerConfig(versionDirective, floatPrecision, temporaryPrefix, newIndent);
    }
}
