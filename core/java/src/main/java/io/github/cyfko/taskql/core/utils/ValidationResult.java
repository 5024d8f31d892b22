package io.github.cyfko.taskql.core.utils;

/**
 * Outcome of validating a filter tree.
 * <p>
 * Instances are immutable and created via {@link #success()} and
 * {@link #failure(String, String, String)}. A failure remembers the offending node so a
 * query builder can highlight it.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = engine.validate(query, true);
 * if (!result.isValid()) {
 *     highlight(result.getNodeId(), result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null, null, null);

    private final boolean valid;
    private final String errorMessage;
    private final String nodeId;
    private final String field;

    private ValidationResult(boolean valid, String errorMessage, String nodeId, String field) {
        this.valid = valid;
        this.errorMessage = errorMessage;
        this.nodeId = nodeId;
        this.field = field;
    }

    /**
     * @return a valid result with no error message
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result not tied to a node
     */
    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage, null, null);
    }

    /**
     * @param errorMessage message explaining the reason for failure
     * @param nodeId       id of the offending node
     * @param field        offending property or attribute
     * @return an invalid result
     */
    public static ValidationResult failure(String errorMessage, String nodeId, String field) {
        return new ValidationResult(false, errorMessage, nodeId, field);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getField() {
        return field;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, node=" + nodeId + ", error=" + errorMessage + "]";
    }
}
