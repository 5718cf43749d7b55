package com.pairtrader.engine.util;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs an operation up to {@code maxAttempts} times with exponential backoff between
 * attempts. Never throws; the caller inspects the {@link RetryOutcome}.
 */
@Slf4j
public final class BackoffRetryExecutor {

    private BackoffRetryExecutor() {
    }

    public static <T> RetryOutcome<T> execute(String name, Supplier<T> operation,
                                              int maxAttempts, Duration baseDelay, double factor) {
        return execute(name, operation, maxAttempts, baseDelay, factor, error -> { });
    }

    /**
     * @param onFailure invoked once for every failed attempt, including the last one
     */
    public static <T> RetryOutcome<T> execute(String name, Supplier<T> operation,
                                              int maxAttempts, Duration baseDelay, double factor,
                                              Consumer<Throwable> onFailure) {
        // resilience4j rejects intervals below one millisecond
        Duration interval = baseDelay == null || baseDelay.toMillis() < 1 ? Duration.ofMillis(1) : baseDelay;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(interval, factor))
                .retryOnException(error -> true)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} attempt={} wait={}ms error={}", name, event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(), describe(event.getLastThrowable())));

        AtomicInteger attempts = new AtomicInteger();
        Supplier<T> counted = () -> {
            attempts.incrementAndGet();
            try {
                return operation.get();
            } catch (RuntimeException e) {
                onFailure.accept(e);
                throw e;
            }
        };
        try {
            T value = Retry.decorateSupplier(retry, counted).get();
            return RetryOutcome.success(value, attempts.get());
        } catch (RuntimeException e) {
            log.error("{} failed after {} attempts: {}", name, attempts.get(), describe(e));
            return RetryOutcome.failure(e, attempts.get());
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
