package io.surfworks.shaderforge.graph;

import java.util.List;

/**
 * An immutable node of a shader expression DAG.
 *
 * <p>Nodes are created by a {@link ShaderSession}, which assigns each one an
 * id that is unique and increasing within that session. Operands are shared
 * references: a node may be an operand of any number of parents. Since a node
 * can only reference nodes that already exist, the operand graph is acyclic.
 *
 * <p>Equality is object identity. Two separately built nodes with the same
 * structure are distinct, and the compiler deduplicates only reused objects.
 */
public final class Node {

    private final long id;
    private final NodeKind kind;
    private final ShaderType type;
    private final List<Node> operands;

    // LITERAL
    private final Object value;
    // VARIABLE
    private final Variable variable;
    // TERM
    private final Op op;
    private final String selector;

    private Node(long id, NodeKind kind, ShaderType type, List<Node> operands,
                 Object value, Variable variable, Op op, String selector) {
        this.id = id;
        this.kind = kind;
        this.type = type;
        this.operands = operands;
        this.value = value;
        this.variable = variable;
        this.op = op;
        this.selector = selector;
    }

    static Node literal(long id, ShaderType type, Object value) {
        return new Node(id, NodeKind.LITERAL, type, List.of(), value, null, null, null);
    }

    static Node variable(long id, Variable variable) {
        return new Node(id, NodeKind.VARIABLE, variable.type(), List.of(), null, variable, null, null);
    }

    static Node term(long id, Op op, ShaderType type, List<Node> operands, String selector) {
        return new Node(id, NodeKind.TERM, type, List.copyOf(operands), null, null, op, selector);
    }

    static Node conditional(long id, ShaderType type, Node condition, Node whenTrue, Node whenFalse) {
        return new Node(id, NodeKind.CONDITIONAL, type, List.of(condition, whenTrue, whenFalse),
                null, null, null, null);
    }

    public long id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public ShaderType type() {
        return type;
    }

    /**
     * Ordered operands. For a conditional: condition, then-value, else-value.
     */
    public List<Node> operands() {
        return operands;
    }

    public Node operand(int index) {
        return operands.get(index);
    }

    /**
     * Literal value: a {@link Double}, {@link Integer} or {@link Boolean}.
     *
     * @throws IllegalStateException if this is not a literal
     */
    public Object value() {
        requireKind(NodeKind.LITERAL);
        return value;
    }

    /**
     * @throws IllegalStateException if this is not a variable
     */
    public Variable variable() {
        requireKind(NodeKind.VARIABLE);
        return variable;
    }

    /**
     * @throws IllegalStateException if this is not a term
     */
    public Op op() {
        requireKind(NodeKind.TERM);
        return op;
    }

    /**
     * Swizzle selector ("xy", "rgb", ...), null unless {@link #op()} is {@link Op#SWIZZLE}.
     */
    public String selector() {
        return selector;
    }

    /**
     * True for literals and variables, which have no operands.
     */
    public boolean isAtom() {
        return kind == NodeKind.LITERAL || kind == NodeKind.VARIABLE;
    }

    private void requireKind(NodeKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Node #" + id + " is a " + kind + ", not a " + expected);
        }
    }

    @Override
    public String toString() {
        String detail = switch (kind) {
            case LITERAL -> String.valueOf(value);
            case VARIABLE -> variable.name();
            case TERM -> op.key() + (selector != null ? " ." + selector : "");
            case CONDITIONAL -> "if";
        };
        return "Node#" + id + "[" + kind + " " + detail + " : " + type.keyword() + "]";
    }
}
