package io.github.cyfko.taskql.core.exception;

/**
 * Exception thrown when a node of a filter tree is structurally invalid.
 * <p>
 * Validation failures are detected before a query runs. They cover property/operator
 * combinations that cannot be evaluated, groups without a conjunction and, when the
 * strict validation path is used, conditions that are still incomplete.
 * </p>
 *
 * <p><strong>Common Validation Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Unsupported Operators:</strong> {@code is-before} on {@code title}</li>
 *   <li><strong>Unknown Properties:</strong> {@code estimate} is neither built-in nor {@code user:}</li>
 *   <li><strong>Missing Values (strict only):</strong> {@code status is} without a value</li>
 * </ul>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     FilterValidator.validate(query.root(), config.getUserFieldsById(), true);
 * } catch (FilterValidationException e) {
 *     log.warning("Rejected node " + e.getNodeId() + " on " + e.getField());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FilterEvaluationException
 */
public class FilterValidationException extends RuntimeException {

    private final String nodeId;
    private final String field;

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the cause of the exception
     */
    public FilterValidationException(String message) {
        this(message, null, null);
    }

    /**
     * Creates an exception pointing at the offending node.
     *
     * @param message the description of the cause of the exception
     * @param nodeId  id of the invalid condition or group, may be null
     * @param field   property selector of the invalid condition, may be null
     */
    public FilterValidationException(String message, String nodeId, String field) {
        super(message);
        this.nodeId = nodeId;
        this.field = field;
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the cause of the exception
     * @param cause   the original cause of the exception
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
        this.nodeId = null;
        this.field = null;
    }

    /**
     * @return id of the offending node, or null when unknown
     */
    public String getNodeId() {
        return nodeId;
    }

    /**
     * @return property selector of the offending condition, or null for groups
     */
    public String getField() {
        return field;
    }
}
