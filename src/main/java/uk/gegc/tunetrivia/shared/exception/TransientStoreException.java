package uk.gegc.tunetrivia.shared.exception;

/**
 * Thrown when an operation kept failing with retryable errors until its attempts ran out.
 * The operation may still succeed later, so callers usually queue it for background replay.
 */
public class TransientStoreException extends StoreOperationException {

    public TransientStoreException(String operationName, int attempts, Throwable cause) {
        super(operationName + " failed after " + attempts + " attempts: " + messageOf(cause),
                operationName, attempts, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    static String messageOf(Throwable cause) {
        return cause == null ? "unknown error" : String.valueOf(cause.getMessage());
    }
}
