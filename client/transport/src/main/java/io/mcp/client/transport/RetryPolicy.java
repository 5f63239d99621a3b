package io.mcp.client.transport;

import java.time.Duration;
import java.util.function.DoubleSupplier;

import io.mcp.util.Assert;

/**
 * Exponential backoff with jitter.
 * <p>
 * The delay before retry {@code n} (zero based) is {@code retryDelay * 2^n}, scaled by a random
 * factor in {@code [1 - jitter, 1 + jitter]} and then capped at {@code maxRetryDelay}. With
 * {@code jitter < 1/3} the smallest jittered delay of a step is still larger than the largest
 * one of the previous step, so delays never decrease.
 *
 * @param maxRetries additional attempts after the first one
 * @param retryDelay base delay before the first retry
 * @param maxRetryDelay upper bound of any single delay
 * @param jitter relative jitter, in {@code [0, 1/3)}
 */
public record RetryPolicy(int maxRetries, Duration retryDelay, Duration maxRetryDelay, double jitter) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_JITTER = 0.2;

    private static final double MAX_JITTER = 1.0 / 3.0;

    public static final RetryPolicy DEFAULT = new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY,
            DEFAULT_MAX_RETRY_DELAY, DEFAULT_JITTER);

    /** A policy performing a single attempt. */
    public static final RetryPolicy NONE = new RetryPolicy(0, DEFAULT_RETRY_DELAY, DEFAULT_MAX_RETRY_DELAY, DEFAULT_JITTER);

    public RetryPolicy {
        Assert.checkNotNullParam("retryDelay", retryDelay);
        Assert.checkNotNullParam("maxRetryDelay", maxRetryDelay);
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
        }
        if (maxRetryDelay.compareTo(retryDelay) < 0) {
            throw new IllegalArgumentException("maxRetryDelay " + maxRetryDelay + " is shorter than retryDelay " + retryDelay);
        }
        if (Double.isNaN(jitter) || jitter < 0.0 || jitter >= MAX_JITTER) {
            throw new IllegalArgumentException("jitter must be within [0, 1/3) but was " + jitter);
        }
    }

    /**
     * Computes the delay before a retry.
     *
     * @param retry zero based index of the retry
     * @param random source of uniformly distributed values in {@code [0, 1)}
     * @return the delay, never longer than {@link #maxRetryDelay()}
     */
    public Duration delayFor(int retry, DoubleSupplier random) {
        if (retry < 0) {
            throw new IllegalArgumentException("retry must not be negative: " + retry);
        }
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        double millis = retryDelay.toMillis() * Math.pow(2, retry) * factor;
        long capped = (long) Math.min(millis, (double) maxRetryDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
