package uk.gegc.tunetrivia.shared.exception;

/**
 * Thrown when an operation failed with an error that retrying cannot fix
 * (constraint violation, authorization failure, malformed payload). Never queued.
 */
public class PermanentStoreException extends StoreOperationException {

    public PermanentStoreException(String operationName, int attempts, Throwable cause) {
        super(operationName + " failed permanently on attempt " + attempts + ": "
                        + TransientStoreException.messageOf(cause),
                operationName, attempts, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
