package io.surfworks.shaderforge.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static io.surfworks.shaderforge.graph.ShaderType.BOOL;
import static io.surfworks.shaderforge.graph.ShaderType.BVEC3;
import static io.surfworks.shaderforge.graph.ShaderType.FLOAT;
import static io.surfworks.shaderforge.graph.ShaderType.INT;
import static io.surfworks.shaderforge.graph.ShaderType.IVEC2;
import static io.surfworks.shaderforge.graph.ShaderType.MAT2;
import static io.surfworks.shaderforge.graph.ShaderType.MAT3;
import static io.surfworks.shaderforge.graph.ShaderType.MAT4;
import static io.surfworks.shaderforge.graph.ShaderType.SAMPLER_2D;
import static io.surfworks.shaderforge.graph.ShaderType.SAMPLER_CUBE;
import static io.surfworks.shaderforge.graph.ShaderType.VEC2;
import static io.surfworks.shaderforge.graph.ShaderType.VEC3;
import static io.surfworks.shaderforge.graph.ShaderType.VEC4;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TypeRules}.
 */
class TypeRulesTest {

    static Stream<Arguments> accepted() {
        return Stream.of(
                Arguments.of(Op.ADD, List.of(FLOAT, FLOAT), FLOAT),
                Arguments.of(Op.ADD, List.of(VEC3, FLOAT), VEC3),
                Arguments.of(Op.SUBTRACT, List.of(FLOAT, VEC2), VEC2),
                Arguments.of(Op.MULTIPLY, List.of(MAT4, VEC4), VEC4),
                Arguments.of(Op.MULTIPLY, List.of(VEC3, MAT3), VEC3),
                Arguments.of(Op.MULTIPLY, List.of(MAT2, MAT2), MAT2),
                Arguments.of(Op.DIVIDE, List.of(IVEC2, INT), IVEC2),
                Arguments.of(Op.NEGATE, List.of(VEC4), VEC4),
                Arguments.of(Op.LESS_THAN, List.of(INT, INT), BOOL),
                Arguments.of(Op.EQUAL, List.of(VEC2, VEC2), BOOL),
                Arguments.of(Op.AND, List.of(BOOL, BOOL), BOOL),
                Arguments.of(Op.NOT, List.of(BOOL), BOOL),
                Arguments.of(Op.SIN, List.of(VEC3), VEC3),
                Arguments.of(Op.ATAN, List.of(FLOAT, FLOAT), FLOAT),
                Arguments.of(Op.POW, List.of(VEC2, VEC2), VEC2),
                Arguments.of(Op.MAX, List.of(VEC4, FLOAT), VEC4),
                Arguments.of(Op.CLAMP, List.of(VEC3, FLOAT, FLOAT), VEC3),
                Arguments.of(Op.MIX, List.of(VEC4, VEC4, FLOAT), VEC4),
                Arguments.of(Op.STEP, List.of(FLOAT, VEC2), VEC2),
                Arguments.of(Op.SMOOTHSTEP, List.of(FLOAT, FLOAT, VEC3), VEC3),
                Arguments.of(Op.LENGTH, List.of(VEC3), FLOAT),
                Arguments.of(Op.DOT, List.of(VEC4, VEC4), FLOAT),
                Arguments.of(Op.CROSS, List.of(VEC3, VEC3), VEC3),
                Arguments.of(Op.REFRACT, List.of(VEC3, VEC3, FLOAT), VEC3),
                Arguments.of(Op.MATRIX_COMP_MULT, List.of(MAT3, MAT3), MAT3),
                Arguments.of(Op.VECTOR_LESS_THAN, List.of(VEC3, VEC3), BVEC3),
                Arguments.of(Op.ANY, List.of(BVEC3), BOOL),
                Arguments.of(Op.TEXTURE_2D, List.of(SAMPLER_2D, VEC2), VEC4),
                Arguments.of(Op.TEXTURE_2D, List.of(SAMPLER_2D, VEC2, FLOAT), VEC4),
                Arguments.of(Op.TEXTURE_CUBE, List.of(SAMPLER_CUBE, VEC3), VEC4),
                Arguments.of(Op.VEC4, List.of(VEC3, FLOAT), VEC4),
                Arguments.of(Op.VEC4, List.of(FLOAT), VEC4),
                Arguments.of(Op.VEC2, List.of(VEC4), VEC2),
                Arguments.of(Op.MAT2, List.of(VEC2, VEC2), MAT2),
                Arguments.of(Op.MAT3, List.of(MAT4), MAT3),
                Arguments.of(Op.TO_FLOAT, List.of(INT), FLOAT),
                Arguments.of(Op.BVEC3, List.of(BOOL, BOOL, BOOL), BVEC3)
        );
    }

    @ParameterizedTest(name = "{0} {1} -> {2}")
    @MethodSource("accepted")
    @DisplayName("Accepted operand types infer the GLSL result type")
    void inferResultType(Op op, List<ShaderType> args, ShaderType expected) {
        assertEquals(expected, TypeRules.infer(op, args, null));
    }

    static Stream<Arguments> rejected() {
        return Stream.of(
                Arguments.of(Op.ADD, List.of(FLOAT, INT)),
                Arguments.of(Op.ADD, List.of(VEC2, VEC3)),
                Arguments.of(Op.ADD, List.of(FLOAT)),
                Arguments.of(Op.MULTIPLY, List.of(MAT4, VEC3)),
                Arguments.of(Op.ADD, List.of(BOOL, BOOL)),
                Arguments.of(Op.LESS_THAN, List.of(VEC2, VEC2)),
                Arguments.of(Op.AND, List.of(BOOL, INT)),
                Arguments.of(Op.SIN, List.of(INT)),
                Arguments.of(Op.CLAMP, List.of(VEC3, VEC2, FLOAT)),
                Arguments.of(Op.CROSS, List.of(VEC2, VEC2)),
                Arguments.of(Op.TEXTURE_2D, List.of(SAMPLER_CUBE, VEC2)),
                Arguments.of(Op.TEXTURE_2D, List.of(SAMPLER_2D, VEC3)),
                Arguments.of(Op.VEC4, List.of(VEC2, FLOAT)),
                Arguments.of(Op.VEC3, List.of(VEC2, VEC2, FLOAT)),
                Arguments.of(Op.MAT2, List.of(MAT2, FLOAT)),
                Arguments.of(Op.TO_FLOAT, List.of(INT, INT)),
                Arguments.of(Op.VEC2, List.of(SAMPLER_2D)),
                Arguments.of(Op.VEC4, List.of())
        );
    }

    @ParameterizedTest(name = "{0} {1}")
    @MethodSource("rejected")
    @DisplayName("Rejected operand types fail with the operator's key")
    void rejectInvalidOperands(Op op, List<ShaderType> args) {
        ConstructionException e = assertThrows(ConstructionException.class, () -> TypeRules.infer(op, args, null));
        assertEquals(op.key(), e.getOperator());
    }

    @Nested
    @DisplayName("Swizzle")
    class Swizzle {

        @ParameterizedTest(name = "{0}.{1} -> {2}")
        @CsvSource({
                "vec4, xyz, vec3",
                "vec4, x, float",
                "vec3, rgb, vec3",
                "vec2, ts, vec2",
                "vec2, xxxx, vec4",
                "ivec3, zy, ivec2",
                "bvec4, w, bool"
        })
        @DisplayName("Selectors pick components of the source element type")
        void validSelectors(String source, String selector, String expected) {
            ShaderType type = ShaderType.fromKeyword(source).orElseThrow();

            assertEquals(ShaderType.fromKeyword(expected).orElseThrow(),
                    TypeRules.infer(Op.SWIZZLE, List.of(type), selector));
        }

        @ParameterizedTest(name = "{0}.{1}")
        @CsvSource({
                "vec2, z",
                "vec4, xg",
                "vec4, xyzwx",
                "vec3, q",
                "float, x",
                "mat2, x"
        })
        @DisplayName("Out of range, mixed or oversized selectors are rejected")
        void invalidSelectors(String source, String selector) {
            ShaderType type = ShaderType.fromKeyword(source).orElseThrow();

            assertThrows(ConstructionException.class, () -> TypeRules.infer(Op.SWIZZLE, List.of(type), selector));
        }
    }

    @Nested
    @DisplayName("Conditional")
    class Conditional {

        @Test
        @DisplayName("Returns the shared branch type")
        void sharedBranchType() {
            assertEquals(VEC3, TypeRules.conditional(BOOL, VEC3, VEC3));
        }

        @Test
        @DisplayName("Rejects non-bool conditions, mismatched branches and samplers")
        void rejects() {
            assertThrows(ConstructionException.class, () -> TypeRules.conditional(FLOAT, VEC3, VEC3));
            assertThrows(ConstructionException.class, () -> TypeRules.conditional(BVEC3, VEC3, VEC3));
            assertThrows(ConstructionException.class, () -> TypeRules.conditional(BOOL, VEC3, VEC4));
            ConstructionException e = assertThrows(ConstructionException.class,
                    () -> TypeRules.conditional(BOOL, SAMPLER_2D, SAMPLER_2D));
            assertTrue(e.getMessage().startsWith("conditional: "));
        }
    }
}
