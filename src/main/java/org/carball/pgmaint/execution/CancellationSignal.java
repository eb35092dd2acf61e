package org.carball.pgmaint.execution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned stop signal for catalog reads and maintenance statements.
 * A signal is cancelled explicitly through {@link #cancel()} or implicitly once its deadline has passed.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Instant deadline;
    private final Clock clock;

    private CancellationSignal(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A signal without deadline; it only fires when {@link #cancel()} is called.
     */
    public static CancellationSignal none() {
        return new CancellationSignal(null, Clock.systemUTC());
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationSignal withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        return new CancellationSignal(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || isExpired();
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Throws {@link CancellationException} naming the activity that was about to start.
     */
    public void throwIfCancelled(String activity) {
        if (cancelled.get()) {
            throw new CancellationException("Cancelled before " + activity);
        }
        if (isExpired()) {
            throw new CancellationException("Timed out before " + activity);
        }
    }

    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Remaining time rounded up to whole seconds, as JDBC query timeouts expect. 0 means no limit.
     */
    public int remainingTimeoutSeconds() {
        return remaining()
                .map(left -> (int) Math.max(1, Math.min(Integer.MAX_VALUE, (left.toMillis() + 999) / 1000)))
                .orElse(0);
    }

    /**
     * Runs {@code action} when the signal is cancelled explicitly. Close the returned handle once the
     * guarded work has finished.
     */
    public Registration onCancel(Runnable action) {
        listeners.add(action);
        if (cancelled.get()) {
            action.run();
        }
        return () -> listeners.remove(action);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
