package io.github.cyfko.taskql.core.exception;

/**
 * Exception thrown when a condition cannot be computed against a task.
 * <p>
 * Unlike {@link FilterValidationException}, which rejects a tree before it runs, this
 * exception signals a runtime failure: a user field that is no longer defined, or an
 * unexpected error raised while reading a task value. The engine never lets it reach
 * its callers; it logs the node and returns an empty result.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterEvaluationException extends RuntimeException {

    private final String nodeId;
    private final String property;

    /**
     * @param message  the description of the failure
     * @param nodeId   id of the condition being evaluated
     * @param property property selector of that condition
     */
    public FilterEvaluationException(String message, String nodeId, String property) {
        super(message);
        this.nodeId = nodeId;
        this.property = property;
    }

    /**
     * @param message  the description of the failure
     * @param nodeId   id of the condition being evaluated
     * @param property property selector of that condition
     * @param cause    the original cause
     */
    public FilterEvaluationException(String message, String nodeId, String property, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.property = property;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getProperty() {
        return property;
    }
}
