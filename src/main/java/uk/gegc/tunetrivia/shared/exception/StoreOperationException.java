package uk.gegc.tunetrivia.shared.exception;

/**
 * Base type for failures raised while applying a persistence operation.
 */
public abstract class StoreOperationException extends RuntimeException {

    private final String operationName;
    private final int attempts;

    protected StoreOperationException(String message, String operationName, int attempts, Throwable cause) {
        super(message, cause);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }

    public abstract boolean isRetryable();
}
