package io.surfworks.shaderforge.graph;

import java.util.List;

/**
 * Result-type inference for terms, following the GLSL ES 1.00 rules.
 *
 * <p>Arithmetic never converts implicitly between int and float. Scalars
 * broadcast against vectors and matrices; {@code *} on matrices is the
 * linear-algebra product. Constructors must consume all of their arguments:
 * every argument but the last must be fully used, or a single scalar (or a
 * single larger vector) may be given.
 */
public final class TypeRules {

    private static final String[] SWIZZLE_SETS = {"xyzw", "rgba", "stpq"};

    private TypeRules() {}

    /**
     * Infers the result type of applying {@code op} to operands of the given types.
     *
     * @param op       the operator
     * @param args     operand types, in order
     * @param selector the swizzle selector, only used for {@link Op#SWIZZLE}
     * @return the result type
     * @throws ConstructionException if arity or operand types are not accepted
     */
    public static ShaderType infer(Op op, List<ShaderType> args, String selector) {
        return switch (op.signature()) {
            case ARITHMETIC -> arithmetic(op, args);
            case NEGATE -> {
                requireArity(op, args, 1);
                requireNumeric(op, args.get(0));
                yield args.get(0);
            }
            case RELATIONAL -> {
                requireArity(op, args, 2);
                requireSame(op, args);
                if (!args.get(0).isScalar() || !args.get(0).isNumeric()) {
                    throw fail(op, "operands must be int or float scalars, got %s", args.get(0));
                }
                yield ShaderType.BOOL;
            }
            case EQUALITY -> {
                requireArity(op, args, 2);
                requireSame(op, args);
                requireNotSampler(op, args.get(0));
                yield ShaderType.BOOL;
            }
            case LOGICAL -> {
                requireArity(op, args, 2);
                requireAll(op, args, ShaderType.BOOL);
                yield ShaderType.BOOL;
            }
            case LOGICAL_NOT -> {
                requireArity(op, args, 1);
                requireAll(op, args, ShaderType.BOOL);
                yield ShaderType.BOOL;
            }
            case FLOAT_UNARY -> {
                requireArity(op, args, 1);
                yield requireGenType(op, args.get(0));
            }
            case FLOAT_BINARY -> {
                requireArity(op, args, 2);
                requireSame(op, args);
                yield requireGenType(op, args.get(0));
            }
            case FLOAT_BINARY_SCALAR_RHS -> {
                requireArity(op, args, 2);
                ShaderType x = requireGenType(op, args.get(0));
                requireSameOrFloat(op, x, args.get(1));
                yield x;
            }
            case FLOAT_TERNARY -> {
                requireArity(op, args, 3);
                requireSame(op, args);
                yield requireGenType(op, args.get(0));
            }
            case ATAN -> {
                requireArity(op, args, 1, 2);
                requireSame(op, args);
                yield requireGenType(op, args.get(0));
            }
            case CLAMP -> {
                requireArity(op, args, 3);
                ShaderType x = requireGenType(op, args.get(0));
                boolean componentwise = args.get(1) == x && args.get(2) == x;
                boolean scalarBounds = args.get(1) == ShaderType.FLOAT && args.get(2) == ShaderType.FLOAT;
                if (!componentwise && !scalarBounds) {
                    throw fail(op, "bounds must both be %s or both be float, got %s and %s",
                            x, args.get(1), args.get(2));
                }
                yield x;
            }
            case MIX -> {
                requireArity(op, args, 3);
                requireSame(op, args.subList(0, 2));
                ShaderType x = requireGenType(op, args.get(0));
                requireSameOrFloat(op, x, args.get(2));
                yield x;
            }
            case STEP -> {
                requireArity(op, args, 2);
                ShaderType x = requireGenType(op, args.get(1));
                requireSameOrFloat(op, x, args.get(0));
                yield x;
            }
            case SMOOTHSTEP -> {
                requireArity(op, args, 3);
                ShaderType x = requireGenType(op, args.get(2));
                boolean componentwise = args.get(0) == x && args.get(1) == x;
                boolean scalarEdges = args.get(0) == ShaderType.FLOAT && args.get(1) == ShaderType.FLOAT;
                if (!componentwise && !scalarEdges) {
                    throw fail(op, "edges must both be %s or both be float, got %s and %s",
                            x, args.get(0), args.get(1));
                }
                yield x;
            }
            case FLOAT_REDUCE_UNARY -> {
                requireArity(op, args, 1);
                requireGenType(op, args.get(0));
                yield ShaderType.FLOAT;
            }
            case FLOAT_REDUCE_BINARY -> {
                requireArity(op, args, 2);
                requireSame(op, args);
                requireGenType(op, args.get(0));
                yield ShaderType.FLOAT;
            }
            case CROSS -> {
                requireArity(op, args, 2);
                requireAll(op, args, ShaderType.VEC3);
                yield ShaderType.VEC3;
            }
            case REFRACT -> {
                requireArity(op, args, 3);
                requireSame(op, args.subList(0, 2));
                ShaderType x = requireGenType(op, args.get(0));
                if (args.get(2) != ShaderType.FLOAT) {
                    throw fail(op, "eta must be float, got %s", args.get(2));
                }
                yield x;
            }
            case MATRIX_COMP_MULT -> {
                requireArity(op, args, 2);
                requireSame(op, args);
                if (!args.get(0).isMatrix()) {
                    throw fail(op, "operands must be matrices, got %s", args.get(0));
                }
                yield args.get(0);
            }
            case VECTOR_RELATIONAL -> {
                requireArity(op, args, 2);
                requireSame(op, args);
                ShaderType v = args.get(0);
                if (!v.isVector() || !v.isNumeric()) {
                    throw fail(op, "operands must be int or float vectors, got %s", v);
                }
                yield ShaderType.of(ShaderType.Element.BOOL, v.size());
            }
            case VECTOR_EQUALITY -> {
                requireArity(op, args, 2);
                requireSame(op, args);
                ShaderType v = args.get(0);
                if (!v.isVector()) {
                    throw fail(op, "operands must be vectors, got %s", v);
                }
                yield ShaderType.of(ShaderType.Element.BOOL, v.size());
            }
            case BOOL_VECTOR_REDUCE -> {
                requireArity(op, args, 1);
                requireBoolVector(op, args.get(0));
                yield ShaderType.BOOL;
            }
            case BOOL_VECTOR_NOT -> {
                requireArity(op, args, 1);
                yield requireBoolVector(op, args.get(0));
            }
            case TEXTURE_2D -> texture(op, args, ShaderType.SAMPLER_2D, ShaderType.VEC2);
            case TEXTURE_CUBE -> texture(op, args, ShaderType.SAMPLER_CUBE, ShaderType.VEC3);
            case CONSTRUCTOR -> construct(op, args);
            case SWIZZLE -> swizzle(op, args, selector);
        };
    }

    /**
     * Checks a conditional's operand types and returns the shared branch type.
     */
    public static ShaderType conditional(ShaderType condition, ShaderType whenTrue, ShaderType whenFalse) {
        if (condition != ShaderType.BOOL) {
            throw new ConstructionException("conditional", "condition must be bool, got " + condition);
        }
        if (whenTrue != whenFalse) {
            throw new ConstructionException("conditional",
                    "branches must have the same type, got " + whenTrue + " and " + whenFalse);
        }
        if (whenTrue.isSampler()) {
            throw new ConstructionException("conditional", "samplers cannot be selected conditionally");
        }
        return whenTrue;
    }

    // ==================== Rule families ====================

    private static ShaderType arithmetic(Op op, List<ShaderType> args) {
        requireArity(op, args, 2);
        ShaderType a = args.get(0);
        ShaderType b = args.get(1);
        requireNumeric(op, a);
        requireNumeric(op, b);
        if (a.element() != b.element()) {
            throw fail(op, "operand element types must match: %s vs %s", a, b);
        }
        if (a == b) {
            return a;
        }
        if (a.isScalar()) {
            return b;
        }
        if (b.isScalar()) {
            return a;
        }
        if (op == Op.MULTIPLY) {
            if (a.isMatrix() && b.isVector() && a.size() == b.size()) {
                return b;
            }
            if (a.isVector() && b.isMatrix() && a.size() == b.size()) {
                return a;
            }
        }
        throw fail(op, "incompatible operand types %s and %s", a, b);
    }

    private static ShaderType texture(Op op, List<ShaderType> args, ShaderType sampler, ShaderType coordinate) {
        requireArity(op, args, 2, 3);
        if (args.get(0) != sampler) {
            throw fail(op, "first operand must be %s, got %s", sampler, args.get(0));
        }
        if (args.get(1) != coordinate) {
            throw fail(op, "coordinate must be %s, got %s", coordinate, args.get(1));
        }
        if (args.size() == 3 && args.get(2) != ShaderType.FLOAT) {
            throw fail(op, "bias must be float, got %s", args.get(2));
        }
        return ShaderType.VEC4;
    }

    private static ShaderType construct(Op op, List<ShaderType> args) {
        ShaderType target = op.constructedType();
        if (args.isEmpty()) {
            throw fail(op, "requires at least one argument");
        }
        for (ShaderType arg : args) {
            requireNotSampler(op, arg);
        }
        if (target.isScalar()) {
            requireArity(op, args, 1);
            return target;
        }
        if (args.size() == 1) {
            ShaderType only = args.get(0);
            if (only.isScalar()) {
                return target;
            }
            if (target.isMatrix() && only.isMatrix()) {
                return target;
            }
            if (target.isVector() && only.isVector() && only.size() >= target.size()) {
                return target;
            }
        }
        for (ShaderType arg : args) {
            if (arg.isMatrix()) {
                throw fail(op, "a matrix argument must be the only argument");
            }
        }
        int needed = target.componentCount();
        int supplied = 0;
        for (int i = 0; i < args.size(); i++) {
            if (supplied >= needed) {
                throw fail(op, "too many arguments: argument %d is unused", i + 1);
            }
            supplied += args.get(i).componentCount();
        }
        if (supplied < needed) {
            throw fail(op, "component count mismatch: expected %d components, got %d", needed, supplied);
        }
        return target;
    }

    private static ShaderType swizzle(Op op, List<ShaderType> args, String selector) {
        requireArity(op, args, 1);
        ShaderType source = args.get(0);
        if (!source.isVector()) {
            throw fail(op, "operand must be a vector, got %s", source);
        }
        if (selector == null || selector.isEmpty() || selector.length() > 4) {
            throw fail(op, "selector must have 1 to 4 components, got '%s'", selector);
        }
        String set = null;
        for (String candidate : SWIZZLE_SETS) {
            if (candidate.indexOf(selector.charAt(0)) >= 0) {
                set = candidate;
                break;
            }
        }
        if (set == null) {
            throw fail(op, "unknown component '%c' in selector '%s'", selector.charAt(0), selector);
        }
        for (int i = 0; i < selector.length(); i++) {
            int index = set.indexOf(selector.charAt(i));
            if (index < 0) {
                throw fail(op, "selector '%s' mixes component sets", selector);
            }
            if (index >= source.size()) {
                throw fail(op, "component '%c' is out of range for %s", selector.charAt(i), source);
            }
        }
        return ShaderType.of(source.element(), selector.length());
    }

    // ==================== Checks ====================

    private static void requireArity(Op op, List<ShaderType> args, int expected) {
        requireArity(op, args, expected, expected);
    }

    private static void requireArity(Op op, List<ShaderType> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw fail(op, "expected %s operands, got %d", expected, args.size());
        }
    }

    private static void requireSame(Op op, List<ShaderType> args) {
        for (ShaderType arg : args) {
            if (arg != args.get(0)) {
                throw fail(op, "operand types must match: %s vs %s", args.get(0), arg);
            }
        }
    }

    private static void requireAll(Op op, List<ShaderType> args, ShaderType expected) {
        for (ShaderType arg : args) {
            if (arg != expected) {
                throw fail(op, "operands must be %s, got %s", expected, arg);
            }
        }
    }

    private static void requireSameOrFloat(Op op, ShaderType x, ShaderType other) {
        if (other != x && other != ShaderType.FLOAT) {
            throw fail(op, "operand must be %s or float, got %s", x, other);
        }
    }

    private static void requireNumeric(Op op, ShaderType type) {
        if (!type.isNumeric()) {
            throw fail(op, "operand must be numeric, got %s", type);
        }
    }

    private static void requireNotSampler(Op op, ShaderType type) {
        if (type.isSampler()) {
            throw fail(op, "%s cannot be used as an operand here", type);
        }
    }

    private static ShaderType requireGenType(Op op, ShaderType type) {
        if (!type.isGenType()) {
            throw fail(op, "operand must be float or vecN, got %s", type);
        }
        return type;
    }

    private static ShaderType requireBoolVector(Op op, ShaderType type) {
        if (!type.isVector() || type.element() != ShaderType.Element.BOOL) {
            throw fail(op, "operand must be a bvecN, got %s", type);
        }
        return type;
    }

    private static ConstructionException fail(Op op, String format, Object... args) {
        return new ConstructionException(op.key(), String.format(format, args));
    }
}
