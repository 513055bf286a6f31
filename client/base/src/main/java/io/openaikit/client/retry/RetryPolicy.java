package io.openaikit.client.retry;

import java.time.Duration;
import java.util.Random;

import io.openaikit.util.Assert;

/**
 * Immutable exponential backoff configuration.
 * <p>
 * The delay before attempt {@code n + 1} is
 * {@code min(baseDelay * multiplier^(n - 1) * jitter, maxDelay)}, with {@code jitter} drawn
 * uniformly from {@code [minJitter, maxJitter]} for every wait.
 */
public final class RetryPolicy {

    public static final double DEFAULT_MIN_JITTER = 0.8;
    public static final double DEFAULT_MAX_JITTER = 1.2;

    private static final RetryPolicy DEFAULTS = builder().build();

    private static final RetryPolicy RATE_LIMIT_OPTIMIZED = builder()
            .maxAttempts(5)
            .baseDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(120))
            .build();

    private static final RetryPolicy NO_RETRY = builder().maxAttempts(1).build();

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double minJitter;
    private final double maxJitter;

    private RetryPolicy(Builder builder) {
        Assert.checkArgument(builder.maxAttempts >= 1, "maxAttempts must be at least 1");
        Assert.checkArgument(!builder.baseDelay.isNegative(), "baseDelay must not be negative");
        Assert.checkArgument(builder.maxDelay.compareTo(builder.baseDelay) >= 0, "maxDelay must not be less than baseDelay");
        Assert.checkArgument(builder.multiplier >= 1.0, "multiplier must be at least 1");
        Assert.checkArgument(builder.minJitter > 0 && builder.minJitter <= builder.maxJitter,
                "jitter band must satisfy 0 < minJitter <= maxJitter");
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.minJitter = builder.minJitter;
        this.maxJitter = builder.maxJitter;
    }

    /**
     * 3 attempts, 1s base delay, 60s cap, doubling.
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * 5 attempts, 2s base delay, 120s cap, doubling. Suited to workloads that regularly hit
     * rate limits.
     */
    public static RetryPolicy rateLimitOptimized() {
        return RATE_LIMIT_OPTIMIZED;
    }

    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    public double minJitter() {
        return minJitter;
    }

    public double maxJitter() {
        return maxJitter;
    }

    /**
     * @param attempt the 1-based number of the attempt that just failed
     * @param jitter the jitter factor for this wait
     * @return the delay before the next attempt, never above {@link #maxDelay()}
     */
    public Duration delayFor(int attempt, double jitter) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1)) * jitter;
        if (Double.isNaN(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.max(0L, Math.round(millis)));
    }

    public double nextJitter(Random random) {
        if (minJitter == maxJitter) {
            return minJitter;
        }
        return minJitter + random.nextDouble() * (maxJitter - minJitter);
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .multiplier(multiplier)
                .jitter(minJitter, maxJitter);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + ", maxDelay=" + maxDelay
                + ", multiplier=" + multiplier + ", jitter=[" + minJitter + ", " + maxJitter + "]}";
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private double minJitter = DEFAULT_MIN_JITTER;
        private double maxJitter = DEFAULT_MAX_JITTER;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Assert.checkNotNullParam("baseDelay", baseDelay);
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Assert.checkNotNullParam("maxDelay", maxDelay);
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitter(double minJitter, double maxJitter) {
            this.minJitter = minJitter;
            this.maxJitter = maxJitter;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
