package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Storage;
import io.surfworks.shaderforge.graph.Variable;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Compiles a vertex and a fragment stage and checks that they fit together.
 *
 * <p>Every varying the fragment stage reads must be written by the vertex
 * stage with the same type, and a uniform used by both stages must have the
 * same type in each. Varyings written but never read are allowed.
 */
public final class ProgramLinker {

    private static final Logger LOG = Logger.getLogger(ProgramLinker.class.getName());

    private final ShaderCompiler compiler;

    public ProgramLinker(ShaderCompiler compiler) {
        this.compiler = compiler;
    }

    public ProgramLinker() {
        this(new ShaderCompiler());
    }

    /**
     * Compiles and links both stages.
     *
     * @throws CompilationException if either stage fails to compile, a
     *         stage is bound to the wrong kind of slots, or the interfaces disagree
     */
    public LinkedProgram link(OutputBindings vertexBindings, OutputBindings fragmentBindings)
            throws CompilationException {
        CompiledProgram vertex = compiler.compile(vertexBindings);
        if (vertex.stage() != ShaderStage.VERTEX) {
            throw new CompilationException(Violation.STAGE_MISMATCH,
                    "first program must be a vertex shader, got " + vertex.stage());
        }
        CompiledProgram fragment = compiler.compile(fragmentBindings);
        if (fragment.stage() != ShaderStage.FRAGMENT) {
            throw new CompilationException(Violation.STAGE_MISMATCH,
                    "second program must be a fragment shader, got " + fragment.stage());
        }
        return link(vertex, fragment);
    }

    /**
     * Checks two already compiled programs against each other.
     */
    public LinkedProgram link(CompiledProgram vertex, CompiledProgram fragment) throws CompilationException {
        Map<String, Variable> written = new HashMap<>();
        for (Variable varying : vertex.writtenVaryings()) {
            written.put(varying.name(), varying);
        }
        for (Variable read : fragment.readVaryings()) {
            Variable source = written.get(read.name());
            if (source == null) {
                throw new CompilationException(Violation.LINK_MISMATCH,
                        "varying " + read.name() + " is read by the fragment shader but never written");
            }
            if (source.type() != read.type()) {
                throw new CompilationException(Violation.LINK_MISMATCH,
                        "varying " + read.name() + " is written as " + source.type() + " but read as " + read.type());
            }
        }

        Map<String, Variable> uniforms = new HashMap<>();
        for (Variable uniform : vertex.declared(Storage.UNIFORM)) {
            uniforms.put(uniform.name(), uniform);
        }
        for (Variable uniform : fragment.declared(Storage.UNIFORM)) {
            Variable other = uniforms.get(uniform.name());
            if (other != null && other.type() != uniform.type()) {
                throw new CompilationException(Violation.LINK_MISMATCH,
                        "uniform " + uniform.name() + " is " + other.type() + " in the vertex shader but "
                                + uniform.type() + " in the fragment shader");
            }
        }

        LOG.fine(() -> String.format("linked program: %d varyings, %d shared uniforms",
                written.size(), fragment.declared(Storage.UNIFORM).stream()
                        .filter(u -> uniforms.containsKey(u.name())).count()));
        return new LinkedProgram(vertex, fragment);
    }
}
