package io.surfworks.shaderforge.graph;

/**
 * Tag distinguishing the four node variants.
 */
public enum NodeKind {
    /** A constant float, int or bool. */
    LITERAL,
    /** A named attribute, uniform, varying or built-in input. */
    VARIABLE,
    /** An operator, built-in function call, constructor or swizzle. */
    TERM,
    /** A three-operand select: condition, then-value, else-value. */
    CONDITIONAL
}
