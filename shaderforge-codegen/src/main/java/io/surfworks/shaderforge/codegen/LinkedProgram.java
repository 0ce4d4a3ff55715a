package io.surfworks.shaderforge.codegen;

/**
 * A vertex and a fragment program whose interfaces agree.
 */
public record LinkedProgram(CompiledProgram vertex, CompiledProgram fragment) {

    public String vertexSource() {
        return vertex.source();
    }

    public String fragmentSource() {
        return fragment.source();
    }
}
