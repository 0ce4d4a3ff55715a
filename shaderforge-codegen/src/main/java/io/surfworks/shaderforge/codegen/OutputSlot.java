package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.ShaderType;
import io.surfworks.shaderforge.graph.Storage;
import io.surfworks.shaderforge.graph.Variable;

import java.util.List;
import java.util.Optional;

/**
 * A named, typed variable a compiled shader assigns to convey a result.
 *
 * @param name    the identifier assigned in source
 * @param type    the type a bound root must have
 * @param stage   the stage the slot belongs to
 * @param varying the declared varying this slot writes, or null for built-in slots
 */
public record OutputSlot(String name, ShaderType type, ShaderStage stage, Variable varying) {

    public static final OutputSlot POSITION = new OutputSlot("gl_Position", ShaderType.VEC4, ShaderStage.VERTEX, null);
    public static final OutputSlot POINT_SIZE = new OutputSlot("gl_PointSize", ShaderType.FLOAT, ShaderStage.VERTEX, null);
    public static final OutputSlot FRAG_COLOR = new OutputSlot("gl_FragColor", ShaderType.VEC4, ShaderStage.FRAGMENT, null);

    private static final List<OutputSlot> BUILTINS = List.of(POSITION, POINT_SIZE, FRAG_COLOR);

    /**
     * Looks up a built-in output slot by name.
     */
    public static Optional<OutputSlot> builtin(String name) {
        return BUILTINS.stream().filter(slot -> slot.name.equals(name)).findFirst();
    }

    /**
     * A vertex-stage slot writing the given varying.
     */
    public static OutputSlot varying(Variable variable) {
        if (variable.storage() != Storage.VARYING) {
            throw new IllegalArgumentException(variable.name() + " is not a varying");
        }
        return new OutputSlot(variable.name(), variable.type(), ShaderStage.VERTEX, variable);
    }

    public boolean isBuiltin() {
        return varying == null;
    }
}
