package io.surfworks.shaderforge.cli;

import io.surfworks.shaderforge.codegen.CompilationException;
import io.surfworks.shaderforge.codegen.CompiledProgram;
import io.surfworks.shaderforge.codegen.CompilerConfig;
import io.surfworks.shaderforge.codegen.CompilerConfigLoader;
import io.surfworks.shaderforge.codegen.LinkedProgram;
import io.surfworks.shaderforge.codegen.OutputBindings;
import io.surfworks.shaderforge.codegen.ProgramLinker;
import io.surfworks.shaderforge.codegen.ShaderCompiler;
import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.Op;
import io.surfworks.shaderforge.graph.ShaderSession;
import io.surfworks.shaderforge.graph.ShaderType;
import io.surfworks.shaderforge.interchange.GraphDocument;
import io.surfworks.shaderforge.interchange.GraphFormatException;
import io.surfworks.shaderforge.interchange.GraphReader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ShaderForgeMain {

    private ShaderForgeMain() {}

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command.
     *
     * @return the process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return 0;
        }

        String command = args[0];
        try {
            return switch (command) {
                case "--help", "-h" -> {
                    printUsage(out);
                    yield 0;
                }
                case "--compile" -> runCompile(args, out, err);
                case "--link" -> runLink(args, out, err);
                case "--example" -> runExample(args, out, err);
                default -> {
                    err.println("Unknown command: " + command);
                    printUsage(err);
                    yield 1;
                }
            };
        } catch (CompilationException e) {
            err.println("Compilation failed: " + e.getMessage());
            return 1;
        } catch (GraphFormatException e) {
            err.println("Invalid graph document: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("ShaderForge CLI - shader graph to GLSL ES compiler");
        out.println();
        out.println("Usage: shaderforge <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  --compile FILE             Compile a JSON graph document and print the shader");
        out.println("  --link VERTEX FRAGMENT     Compile and link a vertex and a fragment document");
        out.println("  --example                  Compile and link the built-in textured quad example");
        out.println("  --help, -h                 Print this help message");
        out.println();
        out.println("Options:");
        out.println("  --config CFG               Read compiler options from CFG instead of");
        out.println("                             " + CompilerConfig.configFile());
    }

    private static int runCompile(String[] args, PrintStream out, PrintStream err)
            throws IOException, GraphFormatException, CompilationException {
        if (args.length < 2 || args[1].startsWith("--")) {
            err.println("Error: --compile requires a FILE argument");
            return 1;
        }
        Path input = Path.of(args[1]);
        if (!Files.exists(input)) {
            err.println("Error: File not found: " + input);
            return 1;
        }
        ShaderCompiler compiler = new ShaderCompiler(loadConfig(args, 2));
        CompiledProgram program = compiler.compile(readBindings(input, new ShaderSession()));
        out.print(program.source());
        return 0;
    }

    private static int runLink(String[] args, PrintStream out, PrintStream err)
            throws IOException, GraphFormatException, CompilationException {
        if (args.length < 3 || args[1].startsWith("--") || args[2].startsWith("--")) {
            err.println("Error: --link requires VERTEX and FRAGMENT arguments");
            return 1;
        }
        Path vertexPath = Path.of(args[1]);
        Path fragmentPath = Path.of(args[2]);
        for (Path path : new Path[] {vertexPath, fragmentPath}) {
            if (!Files.exists(path)) {
                err.println("Error: File not found: " + path);
                return 1;
            }
        }
        ProgramLinker linker = new ProgramLinker(new ShaderCompiler(loadConfig(args, 3)));
        ShaderSession session = new ShaderSession();
        LinkedProgram program = linker.link(readBindings(vertexPath, session), readBindings(fragmentPath, session));
        printLinked(program, out);
        return 0;
    }

    private static int runExample(String[] args, PrintStream out, PrintStream err) throws CompilationException {
        ShaderSession s = new ShaderSession();

        // Vertex stage: transform the position, pass the texture coordinate through.
        Node position = s.attribute("aPosition", ShaderType.VEC3);
        Node texCoord = s.attribute("aTexCoord", ShaderType.VEC2);
        Node mvp = s.uniform("uMvp", ShaderType.MAT4);
        Node vTexCoord = s.varying("vTexCoord", ShaderType.VEC2);
        OutputBindings vertex = new OutputBindings()
                .bind("gl_Position", s.multiply(mvp, s.vec4(position, 1.0)))
                .bind(vTexCoord, texCoord);

        // Fragment stage: sample, then fade out pixels past the threshold.
        Node sampler = s.uniform("uTexture", ShaderType.SAMPLER_2D);
        Node threshold = s.uniform("uThreshold", ShaderType.FLOAT);
        Node texel = s.texture2D(sampler, vTexCoord);
        Node luma = s.term(Op.DOT, s.swizzle(texel, "rgb"), s.vec3(0.299, 0.587, 0.114));
        Node color = s.conditional(s.lessThan(luma, threshold), s.multiply(texel, 0.5), texel);
        OutputBindings fragment = new OutputBindings().bind("gl_FragColor", color);

        ProgramLinker linker = new ProgramLinker(new ShaderCompiler(loadConfig(args, 1)));
        printLinked(linker.link(vertex, fragment), out);
        return 0;
    }

    // ==================== Helpers ====================

    private static OutputBindings readBindings(Path path, ShaderSession session)
            throws IOException, GraphFormatException {
        GraphDocument document = GraphReader.read(path, session);
        return OutputBindings.fromDocument(document);
    }

    private static CompilerConfig loadConfig(String[] args, int from) {
        Path configFile = null;
        for (int i = from; i < args.length; i++) {
            if (args[i].equals("--config") && configFile == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a CFG argument");
                }
                configFile = Path.of(args[++i]);
            } else if (args[i].equals("--config")) {
                throw new IllegalArgumentException("--config given more than once");
            } else {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        if (configFile == null) {
            return CompilerConfigLoader.load();
        }
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        return CompilerConfigLoader.load(configFile);
    }

    private static void printLinked(LinkedProgram program, PrintStream out) {
        out.println("// ==================== Vertex shader ====================");
        out.print(program.vertexSource());
        out.println();
        out.println("// ==================== Fragment shader ====================");
        out.print(program.fragmentSource());
    }
}
