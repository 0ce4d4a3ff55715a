package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;

/**
 * Exception thrown while rendering text, when a value has no representation
 * in the target grammar (a NaN or infinite float literal).
 */
public class EmissionException extends CompilationException {

    public EmissionException(Node node, String message) {
        super(Violation.UNREPRESENTABLE_LITERAL, node, message);
    }
}
