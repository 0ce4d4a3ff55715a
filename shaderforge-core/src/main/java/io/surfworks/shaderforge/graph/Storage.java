package io.surfworks.shaderforge.graph;

/**
 * Storage qualifier of a shader variable.
 */
public enum Storage {
    ATTRIBUTE("attribute"),
    UNIFORM("uniform"),
    VARYING("varying"),
    /** Pre-declared by the language (gl_FragCoord, ...); never declared in source. */
    BUILTIN(null);

    private final String qualifier;

    Storage(String qualifier) {
        this.qualifier = qualifier;
    }

    /**
     * The declaration keyword, or null for built-ins.
     */
    public String qualifier() {
        return qualifier;
    }
}
