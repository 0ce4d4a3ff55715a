package io.surfworks.shaderforge.graph;

/**
 * Thrown when a node cannot be built: wrong operand count, incompatible
 * operand types, or an invalid literal or variable.
 */
public class ConstructionException extends RuntimeException {

    private final String operator;

    public ConstructionException(String operator, String message) {
        super(operator + ": " + message);
        this.operator = operator;
    }

    /**
     * Name of the builder operation that failed ("add", "vec4", "attribute", ...).
     */
    public String getOperator() {
        return operator;
    }
}
