package io.surfworks.shaderforge.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Builds nodes and owns the id source they are numbered from.
 *
 * <p>Ids are unique and increasing within one session. Independent sessions
 * number their nodes independently, so graphs from different sessions must
 * not be mixed in one compilation. A single session may be shared between
 * threads.
 *
 * <p>Wherever a node operand is expected, a {@link Double}, {@link Float},
 * {@link Integer} or {@link Boolean} constant may be passed instead and is
 * wrapped into a literal node.
 *
 * <pre>{@code
 * ShaderSession s = new ShaderSession();
 * Node pos = s.attribute("aPosition", ShaderType.VEC3);
 * Node mvp = s.uniform("uMvp", ShaderType.MAT4);
 * Node clip = s.multiply(mvp, s.vec4(pos, 1.0));
 * }</pre>
 */
public final class ShaderSession {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final AtomicLong nextId = new AtomicLong();

    public ShaderSession() {}

    /**
     * Number of nodes this session has created so far.
     */
    public long nodeCount() {
        return nextId.get();
    }

    // ==================== Atoms ====================

    public Node literal(double value) {
        return Node.literal(nextId.getAndIncrement(), ShaderType.FLOAT, value);
    }

    public Node literal(int value) {
        return Node.literal(nextId.getAndIncrement(), ShaderType.INT, value);
    }

    public Node literal(boolean value) {
        return Node.literal(nextId.getAndIncrement(), ShaderType.BOOL, value);
    }

    /**
     * Declares a vertex attribute. Attributes hold float, vector or matrix values.
     */
    public Node attribute(String name, ShaderType type) {
        requireFloatBased("attribute", name, type);
        return variable(new Variable(name, Storage.ATTRIBUTE, type));
    }

    public Node uniform(String name, ShaderType type) {
        return variable(new Variable(name, Storage.UNIFORM, type));
    }

    /**
     * Declares a varying. Varyings hold float, vector or matrix values.
     */
    public Node varying(String name, ShaderType type) {
        requireFloatBased("varying", name, type);
        return variable(new Variable(name, Storage.VARYING, type));
    }

    public Node builtin(BuiltinVariable builtin) {
        return Node.variable(nextId.getAndIncrement(), builtin.variable());
    }

    private Node variable(Variable variable) {
        String name = variable.name();
        String operator = variable.storage().name().toLowerCase(Locale.ROOT);
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new ConstructionException(operator, "'" + name + "' is not a valid identifier");
        }
        if (ReservedNames.isReserved(name)) {
            throw new ConstructionException(operator, "'" + name + "' uses a reserved name");
        }
        return Node.variable(nextId.getAndIncrement(), variable);
    }

    private static void requireFloatBased(String operator, String name, ShaderType type) {
        if (type.element() != ShaderType.Element.FLOAT) {
            throw new ConstructionException(operator, name + " must be float, vecN or matN, got " + type);
        }
    }

    // ==================== Terms ====================

    /**
     * Applies an operator to operands, inferring the result type.
     *
     * @throws ConstructionException if the operands do not fit the operator's signature
     */
    public Node term(Op op, Object... operands) {
        if (op == Op.SWIZZLE) {
            throw new ConstructionException(op.key(), "use swizzle(vector, selector)");
        }
        List<Node> nodes = toNodes(op.key(), operands);
        ShaderType type = TypeRules.infer(op, types(nodes), null);
        return Node.term(nextId.getAndIncrement(), op, type, nodes, null);
    }

    /**
     * Selects components of a vector, e.g. {@code swizzle(color, "rgb")}.
     */
    public Node swizzle(Object vector, String selector) {
        List<Node> nodes = toNodes(Op.SWIZZLE.key(), vector);
        ShaderType type = TypeRules.infer(Op.SWIZZLE, types(nodes), selector);
        return Node.term(nextId.getAndIncrement(), Op.SWIZZLE, type, nodes, selector);
    }

    /**
     * Selects between two values of the same type.
     */
    public Node conditional(Object condition, Object whenTrue, Object whenFalse) {
        List<Node> nodes = toNodes("conditional", condition, whenTrue, whenFalse);
        ShaderType type = TypeRules.conditional(nodes.get(0).type(), nodes.get(1).type(), nodes.get(2).type());
        return Node.conditional(nextId.getAndIncrement(), type, nodes.get(0), nodes.get(1), nodes.get(2));
    }

    public Node add(Object a, Object b) {
        return term(Op.ADD, a, b);
    }

    public Node subtract(Object a, Object b) {
        return term(Op.SUBTRACT, a, b);
    }

    public Node multiply(Object a, Object b) {
        return term(Op.MULTIPLY, a, b);
    }

    public Node divide(Object a, Object b) {
        return term(Op.DIVIDE, a, b);
    }

    public Node negate(Object a) {
        return term(Op.NEGATE, a);
    }

    public Node lessThan(Object a, Object b) {
        return term(Op.LESS_THAN, a, b);
    }

    public Node greaterThan(Object a, Object b) {
        return term(Op.GREATER_THAN, a, b);
    }

    public Node vec2(Object... components) {
        return term(Op.VEC2, components);
    }

    public Node vec3(Object... components) {
        return term(Op.VEC3, components);
    }

    public Node vec4(Object... components) {
        return term(Op.VEC4, components);
    }

    public Node texture2D(Object sampler, Object coordinate) {
        return term(Op.TEXTURE_2D, sampler, coordinate);
    }

    // ==================== Helpers ====================

    private List<Node> toNodes(String operator, Object... operands) {
        List<Node> nodes = new ArrayList<>(operands.length);
        for (Object operand : operands) {
            nodes.add(toNode(operator, operand));
        }
        return nodes;
    }

    private Node toNode(String operator, Object operand) {
        if (operand instanceof Node node) {
            return node;
        }
        if (operand instanceof Double d) {
            return literal(d.doubleValue());
        }
        if (operand instanceof Float f) {
            return literal(f.doubleValue());
        }
        if (operand instanceof Integer i) {
            return literal(i.intValue());
        }
        if (operand instanceof Boolean b) {
            return literal(b.booleanValue());
        }
        String found = operand == null ? "null" : operand.getClass().getSimpleName();
        throw new ConstructionException(operator, "operand must be a Node or a float, int or bool constant, got " + found);
    }

    private static List<ShaderType> types(List<Node> nodes) {
        List<ShaderType> types = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            types.add(node.type());
        }
        return types;
    }
}
