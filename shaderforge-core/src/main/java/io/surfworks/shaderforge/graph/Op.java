package io.surfworks.shaderforge.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Operators a {@link NodeKind#TERM} node can apply.
 *
 * <p>Every operator has exactly one rendering {@link Form} and one typing
 * {@link Signature}. Both are matched exhaustively by the type rules and the
 * code emitter, so a new constant cannot be added without the compiler
 * pointing at every stage that has to handle it.
 */
public enum Op {

    // ==================== Infix and prefix operators ====================

    ADD("+", Form.INFIX, Signature.ARITHMETIC, Precedence.ADDITIVE),
    SUBTRACT("-", Form.INFIX, Signature.ARITHMETIC, Precedence.ADDITIVE),
    MULTIPLY("*", Form.INFIX, Signature.ARITHMETIC, Precedence.MULTIPLICATIVE),
    DIVIDE("/", Form.INFIX, Signature.ARITHMETIC, Precedence.MULTIPLICATIVE),
    NEGATE("-", Form.PREFIX, Signature.NEGATE, Precedence.UNARY),

    LESS_THAN("<", Form.INFIX, Signature.RELATIONAL, Precedence.RELATIONAL),
    LESS_THAN_EQUAL("<=", Form.INFIX, Signature.RELATIONAL, Precedence.RELATIONAL),
    GREATER_THAN(">", Form.INFIX, Signature.RELATIONAL, Precedence.RELATIONAL),
    GREATER_THAN_EQUAL(">=", Form.INFIX, Signature.RELATIONAL, Precedence.RELATIONAL),
    EQUAL("==", Form.INFIX, Signature.EQUALITY, Precedence.EQUALITY),
    NOT_EQUAL("!=", Form.INFIX, Signature.EQUALITY, Precedence.EQUALITY),

    AND("&&", Form.INFIX, Signature.LOGICAL, Precedence.LOGICAL_AND),
    XOR("^^", Form.INFIX, Signature.LOGICAL, Precedence.LOGICAL_XOR),
    OR("||", Form.INFIX, Signature.LOGICAL, Precedence.LOGICAL_OR),
    NOT("!", Form.PREFIX, Signature.LOGICAL_NOT, Precedence.UNARY),

    // ==================== Built-in functions ====================

    RADIANS("radians", Signature.FLOAT_UNARY),
    DEGREES("degrees", Signature.FLOAT_UNARY),
    SIN("sin", Signature.FLOAT_UNARY),
    COS("cos", Signature.FLOAT_UNARY),
    TAN("tan", Signature.FLOAT_UNARY),
    ASIN("asin", Signature.FLOAT_UNARY),
    ACOS("acos", Signature.FLOAT_UNARY),
    ATAN("atan", Signature.ATAN),
    POW("pow", Signature.FLOAT_BINARY),
    EXP("exp", Signature.FLOAT_UNARY),
    LOG("log", Signature.FLOAT_UNARY),
    EXP2("exp2", Signature.FLOAT_UNARY),
    LOG2("log2", Signature.FLOAT_UNARY),
    SQRT("sqrt", Signature.FLOAT_UNARY),
    INVERSE_SQRT("inversesqrt", Signature.FLOAT_UNARY),
    ABS("abs", Signature.FLOAT_UNARY),
    SIGN("sign", Signature.FLOAT_UNARY),
    FLOOR("floor", Signature.FLOAT_UNARY),
    CEIL("ceil", Signature.FLOAT_UNARY),
    FRACT("fract", Signature.FLOAT_UNARY),
    MOD("mod", Signature.FLOAT_BINARY_SCALAR_RHS),
    MIN("min", Signature.FLOAT_BINARY_SCALAR_RHS),
    MAX("max", Signature.FLOAT_BINARY_SCALAR_RHS),
    CLAMP("clamp", Signature.CLAMP),
    MIX("mix", Signature.MIX),
    STEP("step", Signature.STEP),
    SMOOTHSTEP("smoothstep", Signature.SMOOTHSTEP),
    LENGTH("length", Signature.FLOAT_REDUCE_UNARY),
    DISTANCE("distance", Signature.FLOAT_REDUCE_BINARY),
    DOT("dot", Signature.FLOAT_REDUCE_BINARY),
    CROSS("cross", Signature.CROSS),
    NORMALIZE("normalize", Signature.FLOAT_UNARY),
    FACEFORWARD("faceforward", Signature.FLOAT_TERNARY),
    REFLECT("reflect", Signature.FLOAT_BINARY),
    REFRACT("refract", Signature.REFRACT),
    MATRIX_COMP_MULT("matrixCompMult", Signature.MATRIX_COMP_MULT),
    VECTOR_LESS_THAN("lessThan", Signature.VECTOR_RELATIONAL),
    VECTOR_LESS_THAN_EQUAL("lessThanEqual", Signature.VECTOR_RELATIONAL),
    VECTOR_GREATER_THAN("greaterThan", Signature.VECTOR_RELATIONAL),
    VECTOR_GREATER_THAN_EQUAL("greaterThanEqual", Signature.VECTOR_RELATIONAL),
    VECTOR_EQUAL("equal", Signature.VECTOR_EQUALITY),
    VECTOR_NOT_EQUAL("notEqual", Signature.VECTOR_EQUALITY),
    ANY("any", Signature.BOOL_VECTOR_REDUCE),
    ALL("all", Signature.BOOL_VECTOR_REDUCE),
    VECTOR_NOT("not", Signature.BOOL_VECTOR_NOT),
    TEXTURE_2D("texture2D", Signature.TEXTURE_2D),
    TEXTURE_CUBE("textureCube", Signature.TEXTURE_CUBE),

    // ==================== Constructors ====================

    TO_FLOAT(ShaderType.FLOAT),
    TO_INT(ShaderType.INT),
    TO_BOOL(ShaderType.BOOL),
    VEC2(ShaderType.VEC2),
    VEC3(ShaderType.VEC3),
    VEC4(ShaderType.VEC4),
    IVEC2(ShaderType.IVEC2),
    IVEC3(ShaderType.IVEC3),
    IVEC4(ShaderType.IVEC4),
    BVEC2(ShaderType.BVEC2),
    BVEC3(ShaderType.BVEC3),
    BVEC4(ShaderType.BVEC4),
    MAT2(ShaderType.MAT2),
    MAT3(ShaderType.MAT3),
    MAT4(ShaderType.MAT4),

    // ==================== Component selection ====================

    SWIZZLE(".", Form.SWIZZLE, Signature.SWIZZLE, Precedence.POSTFIX);

    /**
     * How a term is written out.
     */
    public enum Form {
        /** {@code a + b} */
        INFIX,
        /** {@code -a} */
        PREFIX,
        /** {@code name(a, b)} */
        CALL,
        /** {@code vec4(a, b)} */
        CONSTRUCTOR,
        /** {@code a.xyz} */
        SWIZZLE
    }

    /**
     * Typing rule family; see {@link TypeRules}.
     */
    public enum Signature {
        ARITHMETIC, NEGATE, RELATIONAL, EQUALITY, LOGICAL, LOGICAL_NOT,
        FLOAT_UNARY, FLOAT_BINARY, FLOAT_BINARY_SCALAR_RHS, FLOAT_TERNARY, ATAN,
        CLAMP, MIX, STEP, SMOOTHSTEP, FLOAT_REDUCE_UNARY, FLOAT_REDUCE_BINARY,
        CROSS, REFRACT, MATRIX_COMP_MULT,
        VECTOR_RELATIONAL, VECTOR_EQUALITY, BOOL_VECTOR_REDUCE, BOOL_VECTOR_NOT,
        TEXTURE_2D, TEXTURE_CUBE, CONSTRUCTOR, SWIZZLE
    }

    /**
     * GLSL operator precedence, higher binds tighter.
     */
    public static final class Precedence {
        public static final int LOGICAL_OR = 1;
        public static final int LOGICAL_XOR = 2;
        public static final int LOGICAL_AND = 3;
        public static final int EQUALITY = 4;
        public static final int RELATIONAL = 5;
        public static final int ADDITIVE = 6;
        public static final int MULTIPLICATIVE = 7;
        public static final int UNARY = 8;
        public static final int POSTFIX = 9;
        public static final int PRIMARY = 10;

        private Precedence() {}
    }

    private final String symbol;
    private final Form form;
    private final Signature signature;
    private final int precedence;
    private final ShaderType constructedType;

    Op(String symbol, Form form, Signature signature, int precedence) {
        this.symbol = symbol;
        this.form = form;
        this.signature = signature;
        this.precedence = precedence;
        this.constructedType = null;
    }

    Op(String functionName, Signature signature) {
        this(functionName, Form.CALL, signature, Precedence.PRIMARY);
    }

    Op(ShaderType constructedType) {
        this.symbol = constructedType.keyword();
        this.form = Form.CONSTRUCTOR;
        this.signature = Signature.CONSTRUCTOR;
        this.precedence = Precedence.PRIMARY;
        this.constructedType = constructedType;
    }

    /**
     * Operator token, function name or constructor keyword.
     */
    public String symbol() {
        return symbol;
    }

    public Form form() {
        return form;
    }

    public Signature signature() {
        return signature;
    }

    /**
     * Precedence of an expression whose outermost operator is this one.
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Target type of a constructor, null for every other operator.
     */
    public ShaderType constructedType() {
        return constructedType;
    }

    /**
     * Stable external name, e.g. {@code "less_than"} or {@code "vec4"}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up an operator by its {@link #key()}.
     */
    public static Optional<Op> fromKey(String key) {
        for (Op op : values()) {
            if (op.key().equals(key)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
