package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Storage;
import io.surfworks.shaderforge.graph.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one successful compilation.
 *
 * @param stage          the inferred shader stage
 * @param declarations   declared variables, sorted by storage then name
 * @param statements     top-level statements of {@code main}, before the output writes
 * @param outputs        output slot writes, in binding order
 * @param slots          the bound slots, in binding order
 * @param temporaryCount number of temporaries introduced
 * @param source         the complete shader text
 */
public record CompiledProgram(
        ShaderStage stage,
        List<Variable> declarations,
        List<Statement> statements,
        List<Statement.Assignment> outputs,
        List<OutputSlot> slots,
        int temporaryCount,
        String source
) {

    public CompiledProgram {
        declarations = List.copyOf(declarations);
        statements = List.copyOf(statements);
        outputs = List.copyOf(outputs);
        slots = List.copyOf(slots);
    }

    /**
     * Varyings this program writes; empty for fragment programs.
     */
    public List<Variable> writtenVaryings() {
        List<Variable> written = new ArrayList<>();
        for (OutputSlot slot : slots) {
            if (!slot.isBuiltin()) {
                written.add(slot.varying());
            }
        }
        return written;
    }

    /**
     * Varyings this program reads; empty for vertex programs.
     */
    public List<Variable> readVaryings() {
        return stage == ShaderStage.FRAGMENT ? declared(Storage.VARYING) : List.of();
    }

    /**
     * Declared variables with the given storage.
     */
    public List<Variable> declared(Storage storage) {
        List<Variable> result = new ArrayList<>();
        for (Variable variable : declarations) {
            if (variable.storage() == storage) {
                result.add(variable);
            }
        }
        return result;
    }
}
