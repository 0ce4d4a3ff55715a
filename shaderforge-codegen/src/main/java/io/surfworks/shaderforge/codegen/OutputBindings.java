package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.NodeKind;
import io.surfworks.shaderforge.interchange.GraphDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Ordered bindings of root nodes to output slots.
 *
 * <p>Output assignments are emitted in binding order. Slot names are resolved
 * at compile time, so an unknown name surfaces as a {@link CompilationException}.
 *
 * <pre>{@code
 * OutputBindings outputs = new OutputBindings()
 *         .bind("gl_Position", clip)
 *         .bind(vTexCoord, texCoord);
 * }</pre>
 */
public final class OutputBindings {

    /**
     * One binding.
     *
     * @param slotName the slot name, or the varying's name when {@code target} is set
     * @param target   the varying variable node written, or null for a built-in slot
     * @param value    the root node
     */
    public record Binding(String slotName, Node target, Node value) {}

    private final List<Binding> bindings = new ArrayList<>();

    public OutputBindings() {}

    /**
     * Bindings for built-in slots, ordered by slot name.
     */
    public static OutputBindings of(Map<String, Node> bySlotName) {
        OutputBindings outputs = new OutputBindings();
        new TreeMap<>(bySlotName).forEach(outputs::bind);
        return outputs;
    }

    /**
     * Bindings declared in a graph document, in document order.
     */
    public static OutputBindings fromDocument(GraphDocument document) {
        OutputBindings outputs = new OutputBindings();
        for (GraphDocument.Output output : document.outputs()) {
            if (output.target() != null) {
                outputs.bind(output.target(), output.value());
            } else {
                outputs.bind(output.slot(), output.value());
            }
        }
        return outputs;
    }

    /**
     * Binds a built-in slot such as {@code gl_FragColor}.
     */
    public OutputBindings bind(String slotName, Node value) {
        Objects.requireNonNull(slotName, "slotName cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        bindings.add(new Binding(slotName, null, value));
        return this;
    }

    /**
     * Binds a varying variable node; the vertex stage writes it.
     */
    public OutputBindings bind(Node varying, Node value) {
        Objects.requireNonNull(varying, "varying cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        String name = varying.kind() == NodeKind.VARIABLE
                ? varying.variable().name()
                : "#" + varying.id();
        bindings.add(new Binding(name, varying, value));
        return this;
    }

    public List<Binding> bindings() {
        return Collections.unmodifiableList(bindings);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }
}
