package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.ReservedNames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-compilation state: temporary names, bound renderings and statement lists.
 *
 * <p>Keyed by node id, never by structure. Created fresh for every compile
 * call and discarded afterwards.
 */
final class CompilationContext {

    /**
     * Text of an expression and the precedence of its outermost operator.
     */
    record Rendering(String text, int precedence) {}

    private final CompilerConfig config;
    private final Set<String> taken = new HashSet<>();
    private final Map<Long, String> names = new HashMap<>();
    private final Map<Long, Rendering> renderings = new HashMap<>();
    private final Map<Scope, List<Statement>> statements = new HashMap<>();
    private int counter;

    /**
     * @param config        compiler options
     * @param variableNames names of every variable in the program, never reused for temporaries
     */
    CompilationContext(CompilerConfig config, Collection<String> variableNames) {
        this.config = config;
        taken.addAll(variableNames);
    }

    CompilerConfig config() {
        return config;
    }

    // ==================== Temporaries ====================

    /**
     * Allocates a fresh temporary name for a hoisted node.
     */
    String allocate(Node node) {
        if (names.containsKey(node.id())) {
            throw new IllegalStateException("Node #" + node.id() + " already has a temporary");
        }
        String name;
        do {
            name = config.temporaryPrefix() + counter++;
        } while (taken.contains(name) || ReservedNames.isReserved(name));
        taken.add(name);
        names.put(node.id(), name);
        return name;
    }

    String nameOf(Node node) {
        String name = names.get(node.id());
        if (name == null) {
            throw new IllegalStateException("Node #" + node.id() + " has no temporary");
        }
        return name;
    }

    int temporaryCount() {
        return names.size();
    }

    // ==================== Renderings ====================

    /**
     * Records the short text that stands for a node at every use: a literal,
     * a variable or a temporary name. Inlined terms are never bound; their
     * text is written out by {@link CodeEmitter} when a statement needs it.
     */
    void bind(Node node, Rendering rendering) {
        renderings.put(node.id(), rendering);
    }

    /**
     * The bound rendering of a node, or null if the node is an inlined term.
     */
    Rendering bound(Node node) {
        return renderings.get(node.id());
    }

    // ==================== Statements ====================

    /**
     * The statement list accumulated for a scope.
     */
    List<Statement> statements(Scope scope) {
        return statements.computeIfAbsent(scope, s -> new ArrayList<>());
    }
}
