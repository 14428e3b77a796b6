package io.maestro.core.task;

import io.maestro.core.exception.ErrorKind;
import java.time.Duration;
import java.util.Objects;

/// Exponential backoff retry policy.
///
/// A failed task is re-enqueued while `retryCount < maxAttempts` and the failure kind is
/// retryable; the delay before attempt `n + 1` is `min(maxDelay, baseDelay * 2^n)` where `n` is
/// the retry count at the time of failure.
///
/// @param maxAttempts retries allowed after the first execution, not negative
/// @param baseDelay delay before the first retry, not null
/// @param maxDelay upper bound for any delay, not null
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(30));

    public RetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    /// Returns a policy that never retries.
    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    /// Decides whether a failure leads to another attempt.
    ///
    /// @param retryCount retries already performed
    /// @param kind failure classification, not null
    /// @return `true` if the task should be re-enqueued
    public boolean shouldRetry(int retryCount, ErrorKind kind) {
        return kind.isRetryable() && retryCount < maxAttempts;
    }

    /// Computes the backoff before the next attempt.
    ///
    /// @param retryCount retries already performed, not negative
    /// @return delay, never null and never above `maxDelay`
    public Duration backoff(int retryCount) {
        if (retryCount >= 62) {
            return maxDelay;
        }
        long factor = 1L << retryCount;
        long millis = baseDelay.toMillis();
        if (millis > 0 && factor > Long.MAX_VALUE / millis) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(millis * factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
