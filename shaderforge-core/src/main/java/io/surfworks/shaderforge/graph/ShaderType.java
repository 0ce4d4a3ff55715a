package io.surfworks.shaderforge.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * GLSL ES 1.00 value types.
 *
 * <p>Each type knows its keyword, its scalar element kind and its shape.
 * For vectors {@link #size()} is the component count, for matrices it is the
 * column (and row) count, for scalars it is 1 and for samplers 0.
 */
public enum ShaderType {

    BOOL("bool", Element.BOOL, Shape.SCALAR, 1),
    INT("int", Element.INT, Shape.SCALAR, 1),
    FLOAT("float", Element.FLOAT, Shape.SCALAR, 1),

    VEC2("vec2", Element.FLOAT, Shape.VECTOR, 2),
    VEC3("vec3", Element.FLOAT, Shape.VECTOR, 3),
    VEC4("vec4", Element.FLOAT, Shape.VECTOR, 4),
    IVEC2("ivec2", Element.INT, Shape.VECTOR, 2),
    IVEC3("ivec3", Element.INT, Shape.VECTOR, 3),
    IVEC4("ivec4", Element.INT, Shape.VECTOR, 4),
    BVEC2("bvec2", Element.BOOL, Shape.VECTOR, 2),
    BVEC3("bvec3", Element.BOOL, Shape.VECTOR, 3),
    BVEC4("bvec4", Element.BOOL, Shape.VECTOR, 4),

    MAT2("mat2", Element.FLOAT, Shape.MATRIX, 2),
    MAT3("mat3", Element.FLOAT, Shape.MATRIX, 3),
    MAT4("mat4", Element.FLOAT, Shape.MATRIX, 4),

    SAMPLER_2D("sampler2D", Element.NONE, Shape.SAMPLER, 0),
    SAMPLER_CUBE("samplerCube", Element.NONE, Shape.SAMPLER, 0);

    /**
     * Scalar kind of the components of a type.
     */
    public enum Element { BOOL, INT, FLOAT, NONE }

    /**
     * Structural shape of a type.
     */
    public enum Shape { SCALAR, VECTOR, MATRIX, SAMPLER }

    private static final Map<String, ShaderType> BY_KEYWORD = new HashMap<>();

    static {
        for (ShaderType type : values()) {
            BY_KEYWORD.put(type.keyword, type);
        }
    }

    private final String keyword;
    private final Element element;
    private final Shape shape;
    private final int size;

    ShaderType(String keyword, Element element, Shape shape, int size) {
        this.keyword = keyword;
        this.element = element;
        this.shape = shape;
        this.size = size;
    }

    /**
     * Looks up a type by its GLSL keyword ("vec3", "sampler2D", ...).
     */
    public static Optional<ShaderType> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }

    /**
     * Returns the scalar or vector type with the given element kind and width.
     *
     * @param element the component kind
     * @param width   1 for a scalar, 2 to 4 for a vector
     * @throws IllegalArgumentException if no such type exists
     */
    public static ShaderType of(Element element, int width) {
        for (ShaderType type : values()) {
            if (type.element == element && type.size == width
                    && (type.shape == Shape.SCALAR || type.shape == Shape.VECTOR)) {
                return type;
            }
        }
        throw new IllegalArgumentException("No " + element + " type of width " + width);
    }

    /**
     * Returns the square float matrix type of the given dimension.
     */
    public static ShaderType matrix(int dimension) {
        return switch (dimension) {
            case 2 -> MAT2;
            case 3 -> MAT3;
            case 4 -> MAT4;
            default -> throw new IllegalArgumentException("No matrix of dimension " + dimension);
        };
    }

    public String keyword() {
        return keyword;
    }

    public Element element() {
        return element;
    }

    public Shape shape() {
        return shape;
    }

    public int size() {
        return size;
    }

    /**
     * Number of scalar components a value of this type holds.
     */
    public int componentCount() {
        return shape == Shape.MATRIX ? size * size : size;
    }

    public boolean isScalar() {
        return shape == Shape.SCALAR;
    }

    public boolean isVector() {
        return shape == Shape.VECTOR;
    }

    public boolean isMatrix() {
        return shape == Shape.MATRIX;
    }

    public boolean isSampler() {
        return shape == Shape.SAMPLER;
    }

    /**
     * True for int and float based scalars, vectors and matrices.
     */
    public boolean isNumeric() {
        return element == Element.INT || element == Element.FLOAT;
    }

    /**
     * True for {@code float} and the {@code vecN} types ("genType" in the GLSL built-in signatures).
     */
    public boolean isGenType() {
        return element == Element.FLOAT && (shape == Shape.SCALAR || shape == Shape.VECTOR);
    }

    /**
     * Scalar type of this type's components.
     *
     * @throws IllegalStateException for sampler types
     */
    public ShaderType scalar() {
        return switch (element) {
            case BOOL -> BOOL;
            case INT -> INT;
            case FLOAT -> FLOAT;
            case NONE -> throw new IllegalStateException(keyword + " has no scalar component type");
        };
    }

    @Override
    public String toString() {
        return keyword;
    }
}
