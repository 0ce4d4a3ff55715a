package io.surfworks.shaderforge.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ShaderForgeMain}.
 */
class ShaderForgeMainTest {

    private static final String VERTEX = """
            {
              "nodes": [
                {"id": "pos", "kind": "variable", "storage": "attribute", "name": "aPosition", "type": "vec3"},
                {"id": "uv", "kind": "variable", "storage": "attribute", "name": "aTexCoord", "type": "vec2"},
                {"id": "vUv", "kind": "variable", "storage": "varying", "name": "vTexCoord", "type": "vec2"},
                {"id": "one", "kind": "literal", "type": "float", "value": 1.0},
                {"id": "clip", "kind": "term", "op": "vec4", "operands": ["pos", "one"]}
              ],
              "outputs": {"gl_Position": "clip", "vUv": "uv"}
            }
            """;

    private static final String FRAGMENT = """
            {
              "nodes": [
                {"id": "vUv", "kind": "variable", "storage": "varying", "name": "vTexCoord", "type": "vec2"},
                {"id": "tex", "kind": "variable", "storage": "uniform", "name": "uTexture", "type": "sampler2D"},
                {"id": "texel", "kind": "term", "op": "texture_2d", "operands": ["tex", "vUv"]}
              ],
              "outputs": {"gl_FragColor": "texel"}
            }
            """;

    private static final String TINT = """
            {
              "nodes": [
                {"id": "color", "kind": "variable", "storage": "uniform", "name": "uColor", "type": "vec4"},
                {"id": "scale", "kind": "variable", "storage": "uniform", "name": "uScale", "type": "float"},
                {"id": "tinted", "kind": "term", "op": "multiply", "operands": ["color", "scale"]}
              ],
              "outputs": {"gl_FragColor": "tinted"}
            }
            """;

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private Path config;

    @BeforeEach
    void writeConfig() throws IOException {
        config = write("compiler.json", "{\"floatPrecision\": \"highp\", \"indent\": \"    \"}");
    }

    private int run(String... args) {
        return ShaderForgeMain.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Usage")
    class Usage {

        @Test
        void noArgumentsPrintsUsage() {
            assertEquals(0, run());
            assertTrue(out().contains("Usage: shaderforge"));
        }

        @Test
        void helpPrintsUsage() {
            assertEquals(0, run("-h"));
            assertTrue(out().contains("--compile FILE"));
            assertEquals(0, run("--help"));
        }

        @Test
        void unknownCommand() {
            assertEquals(1, run("--frobnicate"));
            assertTrue(err().startsWith("Unknown command: --frobnicate"));
            assertTrue(err().contains("Usage: shaderforge"));
        }
    }

    @Nested
    @DisplayName("--compile")
    class Compile {

        @Test
        void compilesDocument() throws IOException {
            Path input = write("tint.json", TINT);

            assertEquals(0, run("--compile", input.toString(), "--config", config.toString()), err());
            assertEquals("""
                    precision highp float;
                    uniform vec4 uColor;
                    uniform float uScale;

                    void main() {
                        gl_FragColor = uColor * uScale;
                    }
                    """, out());
        }

        @Test
        void requiresFile() {
            assertEquals(1, run("--compile"));
            assertTrue(err().contains("--compile requires a FILE argument"));
        }

        @Test
        void missingFile() {
            Path missing = dir.resolve("missing.json");

            assertEquals(1, run("--compile", missing.toString()));
            assertTrue(err().contains("File not found: " + missing));
        }

        @Test
        void invalidDocument() throws IOException {
            Path input = write("broken.json", "{\"outputs\": {}}");

            assertEquals(1, run("--compile", input.toString(), "--config", config.toString()));
            assertTrue(err().startsWith("Invalid graph document: "), err());
        }

        @Test
        void compilationError() throws IOException {
            Path input = write("empty.json", "{\"nodes\": []}");

            assertEquals(1, run("--compile", input.toString(), "--config", config.toString()));
            assertTrue(err().startsWith("Compilation failed: "), err());
        }

        @Test
        void unknownOption() throws IOException {
            Path input = write("tint.json", TINT);

            assertEquals(1, run("--compile", input.toString(), "--verbose"));
            assertTrue(err().contains("Unknown option: --verbose"));
        }

        @Test
        void argumentsAfterConfigAreRejected() throws IOException {
            Path input = write("tint.json", TINT);

            assertEquals(1, run("--compile", input.toString(), "--config", config.toString(), "--verbose"));
            assertTrue(err().contains("Unknown option: --verbose"), err());
            assertEquals("", out());

            assertEquals(1, run("--compile", input.toString(), "--config", config.toString(), "--config",
                    config.toString()));
            assertTrue(err().contains("--config given more than once"), err());
        }

        @Test
        void missingConfigFile() throws IOException {
            Path input = write("tint.json", TINT);

            assertEquals(1, run("--compile", input.toString(), "--config", dir.resolve("nope.json").toString()));
            assertTrue(err().contains("Config file not found"));
        }
    }

    @Nested
    @DisplayName("--link and --example")
    class Link {

        @Test
        void linksTwoDocuments() throws IOException {
            Path vertex = write("vertex.json", VERTEX);
            Path fragment = write("fragment.json", FRAGMENT);

            assertEquals(0, run("--link", vertex.toString(), fragment.toString(), "--config", config.toString()),
                    err());
            String text = out();
            assertTrue(text.contains("// ==================== Vertex shader ===================="));
            assertTrue(text.contains("    vTexCoord = aTexCoord;"));
            assertTrue(text.contains("// ==================== Fragment shader ===================="));
            assertTrue(text.contains("    gl_FragColor = texture2D(uTexture, vTexCoord);"));
        }

        @Test
        void linkFailure() throws IOException {
            Path vertex = write("vertex.json", VERTEX.replace("\"vUv\": \"uv\"", "\"gl_PointSize\": \"one\""));
            Path fragment = write("fragment.json", FRAGMENT);

            assertEquals(1, run("--link", vertex.toString(), fragment.toString(), "--config", config.toString()));
            assertTrue(err().contains("vTexCoord"), err());
        }

        @Test
        void linkRequiresTwoFiles() {
            assertEquals(1, run("--link", "only.json"));
            assertTrue(err().contains("--link requires VERTEX and FRAGMENT arguments"));
        }

        @Test
        void example() {
            assertEquals(0, run("--example", "--config", config.toString()), err());
            String text = out();
            assertTrue(text.contains("Vertex shader"));
            assertTrue(text.contains("Fragment shader"));
            assertTrue(text.contains("void main() {"));
            assertTrue(text.contains("gl_Position = uMvp * vec4(aPosition, 1.0);"));
            assertTrue(text.contains("if ("));
        }
    }
}
