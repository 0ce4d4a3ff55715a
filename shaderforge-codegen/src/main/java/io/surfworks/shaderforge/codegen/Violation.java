package io.surfworks.shaderforge.codegen;

/**
 * The constraint a failed compilation violated.
 */
public enum Violation {
    /** No output slot was bound. */
    NO_OUTPUTS,
    /** An output slot name is neither a built-in output nor a varying variable. */
    UNKNOWN_OUTPUT_SLOT,
    /** A root node's type differs from the type of the slot it is bound to. */
    TYPE_MISMATCH,
    /** A node id appears again on its own traversal path. */
    CYCLE,
    /** Two different node objects carry the same id. */
    IDENTITY_CONFLICT,
    /** Slots or variables belong to different stages, or a variable is used in the wrong stage. */
    STAGE_MISMATCH,
    /** Two variables share a name but differ in storage or type, or a slot is bound twice. */
    CONFLICTING_DECLARATION,
    /** An operator or node shape the emitter cannot render. */
    UNSUPPORTED_OPERATOR,
    /** A literal that has no representation in the target grammar. */
    UNREPRESENTABLE_LITERAL,
    /** The fragment stage reads a varying the vertex stage does not write. */
    LINK_MISMATCH
}
