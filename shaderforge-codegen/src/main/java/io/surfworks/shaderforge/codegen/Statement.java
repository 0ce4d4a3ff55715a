package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.ShaderType;

import java.util.List;

/**
 * One emitted statement of the {@code main} body.
 */
public sealed interface Statement
        permits Statement.ValueBinding, Statement.Declaration, Statement.Assignment, Statement.ControlBlock {

    /**
     * {@code type name = expression;}
     */
    record ValueBinding(ShaderType type, String name, String expression) implements Statement {}

    /**
     * {@code type name;}, the result temporary of a lowered conditional.
     */
    record Declaration(ShaderType type, String name) implements Statement {}

    /**
     * {@code target = expression;}, a branch result or an output slot write.
     */
    record Assignment(String target, String expression) implements Statement {}

    /**
     * {@code if (condition) { ... } else { ... }}. Statements in a branch are
     * confined to that branch's block.
     */
    record ControlBlock(String condition, List<Statement> thenBranch, List<Statement> elseBranch)
            implements Statement {
        public ControlBlock {
            thenBranch = List.copyOf(thenBranch);
            elseBranch = List.copyOf(elseBranch);
        }
    }
}
