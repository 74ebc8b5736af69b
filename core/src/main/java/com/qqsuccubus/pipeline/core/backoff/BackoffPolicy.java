package com.qqsuccubus.pipeline.core.backoff;

import com.qqsuccubus.pipeline.core.config.PipelineConfig;
import com.qqsuccubus.pipeline.core.error.ErrorKind;
import com.qqsuccubus.pipeline.core.error.PipelineException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Retry mechanism: error classification and jittered exponential delays.
 * <p>
 * The policy holds no judgment of its own about application errors. Pipeline errors
 * carry their {@link ErrorKind}; everything else is classified by the predicate
 * supplied by the business logic.
 * </p>
 * <p>
 * {@code maxAttempts} is the retry budget: {@code nextDelay(n)} stops once {@code n >= maxAttempts},
 * so {@code maxAttempts = 0} dead-letters on the very first failure.
 * </p>
 */
public class BackoffPolicy {

    public enum Classification {
        RETRYABLE,
        NON_RETRYABLE
    }

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final Predicate<Throwable> applicationRetryable;
    private final DoubleSupplier jitter;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts,
                         Predicate<Throwable> applicationRetryable) {
        this(baseDelay, maxDelay, maxAttempts, applicationRetryable,
            () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    }

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts,
                         Predicate<Throwable> applicationRetryable, DoubleSupplier jitter) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.applicationRetryable = applicationRetryable;
        this.jitter = jitter;
    }

    public static BackoffPolicy from(PipelineConfig config, Predicate<Throwable> applicationRetryable) {
        return new BackoffPolicy(
            config.getBaseDelay(), config.getMaxDelay(), config.getMaxAttempts(), applicationRetryable
        );
    }

    /**
     * Maps any failure onto the pipeline error taxonomy.
     *
     * @param error Failure raised by an attempt
     * @return Error kind; application errors become TRANSIENT or VALIDATION
     */
    public ErrorKind kindOf(Throwable error) {
        if (error instanceof PipelineException pipelineError) {
            return pipelineError.getKind();
        }
        if (error instanceof TimeoutException) {
            return ErrorKind.TRANSIENT;
        }
        return applicationRetryable.test(error) ? ErrorKind.TRANSIENT : ErrorKind.VALIDATION;
    }

    public Classification classify(Throwable error) {
        return kindOf(error).isRetryable() ? Classification.RETRYABLE : Classification.NON_RETRYABLE;
    }

    /**
     * Computes the delay before the next retry.
     *
     * @param attempt Retries already performed (0-based)
     * @return Delay, or empty once the retry budget is spent
     */
    public Optional<Duration> nextDelay(int attempt) {
        if (attempt >= maxAttempts) {
            return Optional.empty();
        }
        return Optional.of(JitterBackoff.next(attempt, baseDelay, maxDelay, jitter.getAsDouble()));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
