package in.receipttrack.infrastructure.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded exponential backoff for re-establishing a channel subscription.
 *
 * The policy never gives up: once the delay reaches {@code maxDelay} it stays there.
 * After {@code alertAfterAttempts} consecutive failures {@link #shouldAlert()} turns
 * true so callers can escalate their logging.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.forChannelSubscription();
 *
 * while (running) {
 *     try {
 *         subscribe();
 *         policy.recordSuccess();
 *         consume();
 *     } catch (ChannelException e) {
 *         Duration delay = policy.getNextDelay();
 *         policy.recordFailure();
 *         Thread.sleep(delay.toMillis());
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int alertAfterAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int alertAfterAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.alertAfterAttempts = alertAfterAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and grow the delay, capped at {@code maxDelay}.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
    }

    /**
     * Record a successful attempt. Resets the delay and the failure count.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    /**
     * @return true once consecutive failures reached the alert threshold
     */
    public synchronized boolean shouldAlert() {
        return attemptCount >= alertAfterAttempts;
    }

    /**
     * @return consecutive failed attempts since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * @return time of the last failed attempt, or null if none since the last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for the channel listener: 1s, doubling, capped at one minute,
     * alert after 10 consecutive failures.
     */
    public static ReconnectionPolicy forChannelSubscription() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(1))
            .multiplier(2.0)
            .alertAfterAttempts(10)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private int alertAfterAttempts = 10;

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

        public Builder alertAfterAttempts(int alertAfterAttempts) {
            if (alertAfterAttempts <= 0) {
                throw new IllegalArgumentException("Alert threshold must be positive");
            }
            this.alertAfterAttempts = alertAfterAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, alertAfterAttempts);
        }
    }
}
