package io.surfworks.shaderforge.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CompilerConfigLoader}.
 */
class CompilerConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("A missing file yields the defaults")
    void missingFile() {
        assertEquals(CompilerConfig.defaults(), CompilerConfigLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    @DisplayName("Fields present in the file override the defaults")
    void partialFile() throws IOException {
        Path file = tempDir.resolve("compiler.json");
        Files.writeString(file, "{\"version\": \"100\", \"floatPrecision\": \"highp\"}");

        CompilerConfig config = CompilerConfigLoader.load(file);

        assertEquals("100", config.versionDirective());
        assertEquals("highp", config.floatPrecision());
        assertEquals("t", config.temporaryPrefix());
        assertEquals("  ", config.indent());
    }

    @Test
    @DisplayName("Invalid JSON is ignored")
    void invalidJson() throws IOException {
        Path file = tempDir.resolve("compiler.json");
        Files.writeString(file, "{ not json");

        assertEquals(CompilerConfig.defaults(), CompilerConfigLoader.load(file));
    }

    @Test
    @DisplayName("A JSON value that is not an object is ignored")
    void notAnObject() throws IOException {
        Path file = tempDir.resolve("compiler.json");
        Files.writeString(file, "[1, 2]");

        assertEquals(CompilerConfig.defaults(), CompilerConfigLoader.load(file));
    }

    @Test
    @DisplayName("Invalid option values are reported")
    void invalidValues() throws IOException {
        Path file = tempDir.resolve("compiler.json");
        Files.writeString(file, "{\"floatPrecision\": \"ultra\"}");

        assertThrows(IllegalArgumentException.class, () -> CompilerConfigLoader.load(file));
    }

    @Test
    @DisplayName("save() then load() restores the configuration")
    void saveAndLoad() throws IOException {
        Path file = tempDir.resolve("nested").resolve("compiler.json");
        CompilerConfig config = new CompilerConfig("100", "lowp", "tmp", "\t");

        CompilerConfigLoader.save(config, file);

        assertTrue(Files.exists(file));
        assertEquals(config, CompilerConfigLoader.load(file));
    }
}
