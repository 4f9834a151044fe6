package uk.gegc.tunetrivia.features.operation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.tunetrivia.features.operation.application.AttemptClassifier;
import uk.gegc.tunetrivia.features.operation.application.OperationApplier;
import uk.gegc.tunetrivia.features.operation.application.OperationMetricsService;
import uk.gegc.tunetrivia.features.operation.application.OperationRetryService;
import uk.gegc.tunetrivia.features.operation.config.OperationRetryProperties;
import uk.gegc.tunetrivia.features.operation.domain.model.Operation;
import uk.gegc.tunetrivia.features.operation.domain.model.OperationResult;
import uk.gegc.tunetrivia.shared.exception.PermanentStoreException;
import uk.gegc.tunetrivia.shared.exception.TransientStoreException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Service
@RequiredArgsConstructor
@Slf4j
public class OperationRetryServiceImpl implements OperationRetryService {

    private final OperationApplier operationApplier;
    private final AttemptClassifier defaultClassifier;
    private final OperationRetryProperties retryProperties;
    private final OperationMetricsService metricsService;
    private final Clock clock;

    @Override
    public OperationResult applyWithRetry(Operation operation, AttemptClassifier classifier, String ownerId) {
        int[] attemptsUsed = new int[1];
        List<Map<String, Object>> rows = runWithRetry(
                operation.describe(),
                () -> operationApplier.apply(operation),
                classifier,
                ownerId,
                attemptsUsed
        );
        return new OperationResult(operation, rows, attemptsUsed[0]);
    }

    @Override
    public OperationResult applyWithRetry(Operation operation, String ownerId) {
        return applyWithRetry(operation, defaultClassifier, ownerId);
    }

    @Override
    public <T> T executeWithRetry(String operationName, Callable<T> attempt, AttemptClassifier classifier, String ownerId) {
        return runWithRetry(operationName, attempt, classifier, ownerId, new int[1]);
    }

    @Override
    public long calculateDelay(int attempt) {
        double exponentialDelay = retryProperties.getBaseDelayMs()
                * Math.pow(retryProperties.getBackoffMultiplier(), Math.max(0, attempt - 1));
        return (long) Math.min(exponentialDelay, retryProperties.getMaxDelayMs());
    }

    private <T> T runWithRetry(String operationName,
                               Callable<T> attempt,
                               AttemptClassifier classifier,
                               String ownerId,
                               int[] attemptsUsed) {
        AttemptClassifier effectiveClassifier = classifier != null ? classifier : defaultClassifier;
        int maxAttempts = Math.max(1, retryProperties.getMaxAttempts());
        Instant start = clock.instant();
        Exception lastError = null;

        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            attemptsUsed[0] = attemptNumber;
            try {
                if (attemptNumber > 1) {
                    log.info("Retrying {} for owner {} - attempt {}/{}", operationName, ownerId, attemptNumber, maxAttempts);
                }

                T result = attempt.call();

                if (attemptNumber > 1) {
                    Duration recoveryTime = Duration.between(start, clock.instant());
                    log.info("{} for owner {} recovered after {} attempts ({} ms)",
                            operationName, ownerId, attemptNumber, recoveryTime.toMillis());
                    metricsService.recordRecovered(operationName, attemptNumber, recoveryTime);
                }
                return result;

            } catch (Exception e) {
                lastError = e;
                boolean retryable = effectiveClassifier.isRetryable(e);
                boolean willRetry = retryable && attemptNumber < maxAttempts;

                log.warn("{} for owner {} failed on attempt {}/{} (retryable: {}, will retry: {}): {}",
                        operationName, ownerId, attemptNumber, maxAttempts, retryable, willRetry, e.getMessage());

                if (!retryable) {
                    metricsService.recordPermanentFailure(operationName);
                    throw new PermanentStoreException(operationName, attemptNumber, e);
                }
                if (!willRetry) {
                    break;
                }

                long delayMs = calculateDelay(attemptNumber);
                log.debug("{} - waiting {} ms before attempt {}", operationName, delayMs, attemptNumber + 1);
                sleepBeforeRetry(operationName, attemptNumber, delayMs);
            }
        }

        log.error("{} for owner {} failed after {} attempts", operationName, ownerId, maxAttempts, lastError);
        metricsService.recordExhausted(operationName, maxAttempts);
        throw new TransientStoreException(operationName, maxAttempts, lastError);
    }

    /**
     * Wait between two attempts. Tests override this to avoid actual sleeping.
     */
    protected void sleepBeforeRetry(String operationName, int attemptNumber, long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException(operationName, attemptNumber, ie);
        }
    }
}
