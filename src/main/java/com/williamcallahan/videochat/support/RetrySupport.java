package com.williamcallahan.videochat.support;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries Qdrant calls that fail transiently, with capped exponential backoff.
 *
 * <p>Transience is decided by {@link RetrievalErrorClassifier#isTransientVectorStoreError(Throwable)}.
 * Any other failure is rethrown from the attempt that raised it.
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Policy used by the vector index for every gRPC round trip. */
    public static final Policy VECTOR_STORE = new Policy(3, Duration.ofMillis(500), Duration.ofSeconds(8));

    private RetrySupport() {}

    /**
     * Attempt count and backoff bounds for one retried call.
     *
     * @param maxAttempts total attempts including the first
     * @param initialBackoff pause before the second attempt
     * @param maxBackoff upper bound for any pause
     */
    public record Policy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        public Policy {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            Objects.requireNonNull(initialBackoff, "initialBackoff");
            Objects.requireNonNull(maxBackoff, "maxBackoff");
        }

        Duration pauseBefore(int attempt) {
            int doublings = Math.min(Math.max(attempt - 2, 0), 16);
            long millis = initialBackoff.toMillis() << doublings;
            return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
        }
    }

    public static <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(operation, operationName, VECTOR_STORE);
    }

    /**
     * Runs {@code operation}, retrying transient vector store failures according to {@code policy}.
     *
     * @param operation call to run
     * @param operationName label for log lines
     * @param policy attempts and backoff
     * @param <T> result type
     * @return the first successful result
     */
    public static <T> T executeWithRetry(Supplier<T> operation, String operationName, Policy policy) {
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException failure) {
                boolean transientFailure = RetrievalErrorClassifier.isTransientVectorStoreError(failure);
                if (!transientFailure || attempt >= policy.maxAttempts()) {
                    log.warn("[QDRANT] {} failed on attempt {}/{} ({}), giving up",
                            operationName,
                            attempt,
                            policy.maxAttempts(),
                            transientFailure ? RetrievalErrorClassifier.determineErrorType(failure) : "non-transient");
                    throw failure;
                }
                attempt++;
                Duration pause = policy.pauseBefore(attempt);
                log.warn("[QDRANT] {} failed with {}; attempt {}/{} in {}ms",
                        operationName,
                        RetrievalErrorClassifier.determineErrorType(failure),
                        attempt,
                        policy.maxAttempts(),
                        pause.toMillis());
                pause(pause);
            }
        }
    }

    private static void pause(Duration pause) {
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry a Qdrant call", interrupted);
        }
    }
}
