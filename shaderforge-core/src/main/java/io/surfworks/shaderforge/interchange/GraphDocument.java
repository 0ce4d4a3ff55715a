package io.surfworks.shaderforge.interchange;

import io.surfworks.shaderforge.graph.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A graph read from JSON: its nodes by document id and its output bindings.
 *
 * @param nodes   every node in document order, keyed by document id
 * @param outputs output bindings in document order
 */
public record GraphDocument(Map<String, Node> nodes, List<Output> outputs) {

    public GraphDocument {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        outputs = List.copyOf(outputs);
    }

    /**
     * One output binding.
     *
     * @param slot   the slot key as written in the document
     * @param target the varying node the key refers to, or null for a built-in slot name
     * @param value  the bound root node
     */
    public record Output(String slot, Node target, Node value) {}

    public Optional<Node> node(String documentId) {
        return Optional.ofNullable(nodes.get(documentId));
    }
}
