package dev.shelfscan.inventory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum interval between consecutive calls to a rate limited collaborator.
 */
public class CallPacer {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration minInterval;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private long lastCallNanos;
    private boolean called;

    public CallPacer(Duration minInterval) {
        this(minInterval, System::nanoTime, duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000));
    }

    public CallPacer(Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
        this.minInterval = minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public static CallPacer unpaced() {
        return new CallPacer(Duration.ZERO);
    }

    public Duration minInterval() {
        return minInterval;
    }

    /**
     * Blocks until at least {@code minInterval} has passed since the previous call returned from here.
     */
    public synchronized void awaitTurn() {
        if (minInterval.isZero()) {
            return;
        }
        long now = nanoClock.getAsLong();
        if (called) {
            long remaining = minInterval.toNanos() - (now - lastCallNanos);
            if (remaining > 0) {
                try {
                    sleeper.sleep(Duration.ofNanos(remaining));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new ExternalServiceException("Interrupted while pacing model calls", ex);
                }
                now = nanoClock.getAsLong();
            }
        }
        lastCallNanos = now;
        called = true;
    }
}
