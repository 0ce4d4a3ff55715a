package io.surfworks.shaderforge.interchange;

/**
 * Thrown when a graph document is malformed: bad JSON, an unknown kind,
 * operator, type or storage, a reference to an undefined node, or operands
 * the operator does not accept.
 */
public class GraphFormatException extends Exception {

    private final String nodeId;

    public GraphFormatException(String message) {
        super(message);
        this.nodeId = null;
    }

    public GraphFormatException(String nodeId, String message) {
        super("node '" + nodeId + "': " + message);
        this.nodeId = nodeId;
    }

    public GraphFormatException(String nodeId, String message, Throwable cause) {
        super("node '" + nodeId + "': " + message, cause);
        this.nodeId = nodeId;
    }

    /**
     * Document id of the offending node, or null if the error is not tied to one.
     */
    public String getNodeId() {
        return nodeId;
    }
}
