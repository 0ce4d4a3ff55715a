package io.surfworks.shaderforge.codegen;

/**
 * Pipeline stage a compiled shader runs in.
 */
public enum ShaderStage {
    VERTEX,
    FRAGMENT
}
