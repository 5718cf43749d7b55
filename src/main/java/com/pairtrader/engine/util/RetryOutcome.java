package com.pairtrader.engine.util;

/**
 * Result of a retried operation. Exactly one of {@code value} and {@code lastError} is set.
 */
public record RetryOutcome<T>(boolean success, T value, Throwable lastError, int attempts) {

    public static <T> RetryOutcome<T> success(T value, int attempts) {
        return new RetryOutcome<>(true, value, null, attempts);
    }

    public static <T> RetryOutcome<T> failure(Throwable error, int attempts) {
        return new RetryOutcome<>(false, null, error, attempts);
    }

    public String errorMessage() {
        if (lastError == null) {
            return null;
        }
        return lastError.getMessage() != null ? lastError.getMessage() : lastError.getClass().getSimpleName();
    }
}
