package in.pricehub.infrastructure.upstream.common;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnection policy with exponential backoff and jitter for the upstream price feed.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum backoff duration (cap)
 * - Subtractive jitter: each delay lies in (base * (1 - jitter), base]
 * - Reset after successful connection
 * - No attempt limit: the feed retries until it is shut down
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .jitter(0.2)
 *     .build();
 *
 * // on drop:
 * Duration wait = policy.getNextDelay();
 * policy.recordFailure();
 * loop.schedule(this::connect, wait);
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitter;
    private final DoubleSupplier random;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, double jitter, DoubleSupplier random) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
        this.currentDelay = initialDelay;
    }

    /**
     * Get the delay before the next retry attempt: the current backoff step minus jitter.
     *
     * @return Duration to wait before next attempt
     */
    public synchronized Duration getNextDelay() {
        if (jitter == 0.0) {
            return currentDelay;
        }
        long base = currentDelay.toMillis();
        long reduction = (long) (base * jitter * random.getAsDouble());
        return Duration.ofMillis(Math.max(1L, base - reduction));
    }

    /**
     * Un-jittered backoff step.
     */
    public synchronized Duration getBaseDelay() {
        return currentDelay;
    }

    /**
     * Record a failed connection attempt.
     * Increments attempt count and calculates next backoff delay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
    }

    /**
     * Record a successful connection.
     * Resets counters and delay.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
    }

    /**
     * Get current attempt count.
     *
     * @return Number of failed attempts since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * Get time of last attempt.
     *
     * @return Instant of last failed attempt, or null if none since the last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    /**
     * Create a builder for ReconnectionPolicy.
     *
     * @return Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for the upstream price WebSocket: 1s doubling up to 30s, 20% jitter.
     *
     * @return ReconnectionPolicy with default feed settings
     */
    public static ReconnectionPolicy forUpstreamFeed() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .jitter(0.2)
            .build();
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private double jitter = 0.0;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitter(double jitter) {
            if (jitter < 0.0 || jitter >= 1.0) {
                throw new IllegalArgumentException("Jitter must be in [0.0, 1.0)");
            }
            this.jitter = jitter;
            return this;
        }

        /**
         * Source of uniform values in [0, 1) for jitter. Tests pin it.
         */
        public Builder random(DoubleSupplier random) {
            if (random == null) {
                throw new IllegalArgumentException("Random source cannot be null");
            }
            this.random = random;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, jitter, random);
        }
    }
}
