package io.surfworks.shaderforge.graph;

import java.util.Objects;

/**
 * A named shader variable referenced by a {@link NodeKind#VARIABLE} node.
 *
 * @param name    the identifier as it appears in source
 * @param storage the storage qualifier
 * @param type    the declared type
 */
public record Variable(String name, Storage storage, ShaderType type) {

    public Variable {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(storage, "storage cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    /**
     * Declaration text, e.g. {@code uniform mat4 uMvp;}.
     *
     * @throws IllegalStateException for built-in variables, which are never declared
     */
    public String declaration() {
        if (storage == Storage.BUILTIN) {
            throw new IllegalStateException("Built-in variable " + name + " is not declared");
        }
        return storage.qualifier() + " " + type.keyword() + " " + name + ";";
    }
}
