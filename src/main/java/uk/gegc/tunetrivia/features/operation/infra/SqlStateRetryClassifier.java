package uk.gegc.tunetrivia.features.operation.infra;

import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import uk.gegc.tunetrivia.features.operation.application.AttemptClassifier;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link AttemptClassifier}: connection loss, resource exhaustion, serialization
 * failures and deadlocks are retryable; constraint violations, auth failures and bad
 * payloads are not.
 */
@Component
public class SqlStateRetryClassifier implements AttemptClassifier {

    /**
     * Connection exceptions (08xxx), too many connections, serialization failure, deadlock.
     * 08001 and 08S01 are what MySQL Connector/J reports for refused and dropped links.
     */
    static final Set<String> RETRYABLE_SQL_STATES = Set.of(
            "08000", "08001", "08003", "08006", "08S01", "53300", "40001", "40P01"
    );

    static final Set<String> RETRYABLE_MESSAGE_FRAGMENTS = Set.of(
            "network error", "timeout", "connection", "econnreset", "enotfound", "etimedout"
    );

    private static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public boolean isRetryable(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (isRetryableType(current) || hasRetryableSqlState(current) || hasRetryableMessage(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean isRetryableType(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof SQLTransientException
                || error instanceof ConnectException
                || error instanceof SocketTimeoutException
                || error instanceof SocketException
                || error instanceof TimeoutException;
    }

    private boolean hasRetryableSqlState(Throwable error) {
        if (!(error instanceof SQLException sqlException)) {
            return false;
        }
        String sqlState = sqlException.getSQLState();
        return sqlState != null && RETRYABLE_SQL_STATES.contains(sqlState.toUpperCase(Locale.ROOT));
    }

    private boolean hasRetryableMessage(Throwable error) {
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String fragment : RETRYABLE_MESSAGE_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
