package io.surfworks.shaderforge.graph;

/**
 * Read-only built-in inputs of the fragment stage.
 */
public enum BuiltinVariable {
    FRAG_COORD("gl_FragCoord", ShaderType.VEC4),
    FRONT_FACING("gl_FrontFacing", ShaderType.BOOL),
    POINT_COORD("gl_PointCoord", ShaderType.VEC2);

    private final String glslName;
    private final ShaderType type;

    BuiltinVariable(String glslName, ShaderType type) {
        this.glslName = glslName;
        this.type = type;
    }

    public String glslName() {
        return glslName;
    }

    public ShaderType type() {
        return type;
    }

    public Variable variable() {
        return new Variable(glslName, Storage.BUILTIN, type);
    }

    /**
     * True if the given name is one of the built-in inputs.
     */
    public static boolean isBuiltin(String name) {
        for (BuiltinVariable builtin : values()) {
            if (builtin.glslName.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
