package in.receipttrack.infrastructure.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keepalive for one client connection: sends a ping every {@code pingInterval} and
 * reports the connection dead when no pong arrives within {@code timeout}.
 *
 * All heartbeats run on a shared scheduler owned by the caller; a heartbeat only
 * ever cancels its own tasks.
 *
 * Usage:
 * <pre>
 * HeartbeatManager heartbeat = new HeartbeatManager(
 *     "conn-42",
 *     scheduler,
 *     Duration.ofSeconds(30),  // ping every 30 seconds
 *     Duration.ofSeconds(60),  // dead after 60 seconds without pong
 *     () -> sendPing(),
 *     () -> close("keepalive timeout")
 * );
 *
 * heartbeat.start();
 * // when a pong frame arrives:
 * heartbeat.recordPong();
 * // when the connection closes:
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String label;
    private final ScheduledExecutorService scheduler;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Runnable onExpired;

    private ScheduledFuture<?> pingTask;
    private ScheduledFuture<?> timeoutTask;
    private volatile Instant lastPongTime;
    private boolean running = false;
    private boolean expired = false;

    public HeartbeatManager(String label, ScheduledExecutorService scheduler,
                            Duration pingInterval, Duration timeout,
                            Runnable pingFunction, Runnable onExpired) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.label = label;
        this.scheduler = scheduler;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.onExpired = onExpired;
    }

    /**
     * Start sending periodic pings. The first ping goes out after one interval.
     */
    public synchronized void start() {
        if (running || expired) {
            return;
        }
        running = true;
        lastPongTime = Instant.now();

        log.debug("[{}] Heartbeat started (ping every {}ms, timeout {}ms)",
            label, pingInterval.toMillis(), timeout.toMillis());

        pingTask = scheduler.scheduleAtFixedRate(this::sendPing,
            pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Cancel pings and pending timeout checks. Safe to call more than once.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
        log.debug("[{}] Heartbeat stopped", label);
    }

    /**
     * Record receipt of a pong frame.
     */
    public synchronized void recordPong() {
        lastPongTime = Instant.now();
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
    }

    public boolean isExpired() {
        synchronized (this) {
            return expired;
        }
    }

    /**
     * @return time since the last pong (or since start), null before start
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return null;
        }
        return Duration.between(lastPong, Instant.now());
    }

    private void sendPing() {
        synchronized (this) {
            if (!running) {
                return;
            }
        }

        try {
            pingFunction.run();
        } catch (RuntimeException e) {
            log.debug("[{}] Ping failed: {}", label, e.toString());
            expire("ping failed");
            return;
        }

        scheduleTimeoutCheck();
    }

    private synchronized void scheduleTimeoutCheck() {
        if (!running || timeoutTask != null) {
            // A check is already pending for an earlier unanswered ping.
            return;
        }
        timeoutTask = scheduler.schedule(() -> {
            synchronized (this) {
                timeoutTask = null;
            }
            if (isWithinTimeout()) {
                return;
            }
            expire("no pong for " + timeout.toMillis() + "ms");
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isWithinTimeout() {
        Instant lastPong = lastPongTime;
        return lastPong != null && Duration.between(lastPong, Instant.now()).compareTo(timeout) < 0;
    }

    private void expire(String why) {
        synchronized (this) {
            if (expired || !running) {
                return;
            }
            expired = true;
        }
        log.info("[{}] Heartbeat expired: {}", label, why);
        stop();
        try {
            onExpired.run();
        } catch (RuntimeException e) {
            log.error("[{}] Expiry callback threw exception", label, e);
        }
    }
}
