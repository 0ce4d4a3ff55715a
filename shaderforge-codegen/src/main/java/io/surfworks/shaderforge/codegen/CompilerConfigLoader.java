package io.surfworks.shaderforge.codegen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads and saves {@link CompilerConfig}.
 *
 * <p>A missing file yields the defaults. Fields absent from the file keep
 * their default values.
 */
public final class CompilerConfigLoader {

    private static final Logger LOG = Logger.getLogger(CompilerConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private CompilerConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static CompilerConfig load() {
        return load(CompilerConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * <p>An unreadable or non-JSON file is logged and ignored.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws IllegalArgumentException if the file holds invalid option values
     */
    public static CompilerConfig load(Path configFile) {
        CompilerConfig config = CompilerConfig.defaults();
        if (!Files.exists(configFile)) {
            return config;
        }
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring compiler config " + configFile + ": not a JSON object");
                return config;
            }
            if (root.hasNonNull("version")) {
                config = config.withVersionDirective(root.get("version").asText());
            }
            config = config
                    .withFloatPrecision(getStringOrDefault(root, "floatPrecision", config.floatPrecision()))
                    .withTemporaryPrefix(getStringOrDefault(root, "temporaryPrefix", config.temporaryPrefix()))
                    .withIndent(getStringOrDefault(root, "indent", config.indent()));
            return config;
        } catch (IOException e) {
            LOG.warning("Ignoring unreadable compiler config " + configFile + ": " + e.getMessage());
            return CompilerConfig.defaults();
        }
    }

    /**
     * Saves configuration to a specific file.
     *
     * @throws IOException if saving fails
     */
    public static void save(CompilerConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }
        ObjectNode root = JSON.createObjectNode();
        if (config.versionDirective() != null) {
            root.put("version", config.versionDirective());
        }
        root.put("floatPrecision", config.floatPrecision());
        root.put("temporaryPrefix", config.temporaryPrefix());
        root.put("indent", config.indent());
        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }
}
