package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.NodeKind;

/**
 * Exception thrown when a graph cannot be compiled.
 *
 * <p>Compilation is all-or-nothing: when this is thrown no source text has
 * been produced. The exception names the violated constraint and, where the
 * failure is tied to a node, that node's id and kind.
 */
public class CompilationException extends Exception {

    private final Violation violation;
    private final long nodeId;
    private final NodeKind nodeKind;

    public CompilationException(Violation violation, String message) {
        super("[" + violation + "] " + message);
        this.violation = violation;
        this.nodeId = -1;
        this.nodeKind = null;
    }

    public CompilationException(Violation violation, Node node, String message) {
        super("[" + violation + "] node #" + node.id() + " (" + node.kind() + "): " + message);
        this.violation = violation;
        this.nodeId = node.id();
        this.nodeKind = node.kind();
    }

    public Violation getViolation() {
        return violation;
    }

    /**
     * Id of the offending node, or -1 if the failure is not tied to a node.
     */
    public long getNodeId() {
        return nodeId;
    }

    /**
     * Kind of the offending node, or null if the failure is not tied to a node.
     */
    public NodeKind getNodeKind() {
        return nodeKind;
    }
}
