package io.surfworks.shaderforge.graph;

import java.util.HashSet;
import java.util.Set;

/**
 * Identifiers a shader may not declare: GLSL ES 1.00 keywords and reserved
 * words, {@code main}, built-in function names and the {@code gl_} and
 * {@code __} namespaces.
 */
public final class ReservedNames {

    private static final Set<String> KEYWORDS = Set.of(
            "attribute", "const", "uniform", "varying", "break", "continue", "do", "for", "while",
            "if", "else", "in", "out", "inout", "float", "int", "void", "bool", "true", "false",
            "lowp", "mediump", "highp", "precision", "invariant", "discard", "return", "struct",
            "mat2", "mat3", "mat4", "vec2", "vec3", "vec4", "ivec2", "ivec3", "ivec4",
            "bvec2", "bvec3", "bvec4", "sampler2D", "samplerCube",
            "asm", "class", "union", "enum", "typedef", "template", "this", "packed", "goto",
            "switch", "default", "inline", "noinline", "volatile", "public", "static", "extern",
            "external", "interface", "flat", "long", "short", "double", "half", "fixed", "unsigned",
            "superp", "input", "output", "hvec2", "hvec3", "hvec4", "dvec2", "dvec3", "dvec4",
            "fvec2", "fvec3", "fvec4", "sampler1D", "sampler3D", "sampler1DShadow", "sampler2DShadow",
            "sampler2DRect", "sampler3DRect", "sampler2DRectShadow", "sizeof", "cast", "namespace",
            "using", "main");

    // Built-ins with no operator of their own.
    private static final Set<String> EXTRA_FUNCTIONS = Set.of(
            "texture2DProj", "texture2DLod", "texture2DProjLod", "textureCubeLod");

    private static final Set<String> FUNCTIONS = functions();

    private ReservedNames() {}

    private static Set<String> functions() {
        Set<String> names = new HashSet<>(EXTRA_FUNCTIONS);
        for (Op op : Op.values()) {
            if (op.form() == Op.Form.CALL) {
                names.add(op.symbol());
            }
        }
        return Set.copyOf(names);
    }

    /**
     * True if the name cannot be used for a variable or a temporary.
     */
    public static boolean isReserved(String name) {
        return KEYWORDS.contains(name) || FUNCTIONS.contains(name)
                || name.startsWith("gl_") || name.contains("__");
    }
}
