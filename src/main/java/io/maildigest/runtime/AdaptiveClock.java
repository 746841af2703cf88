package io.maildigest.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single perpetual timer driving poll cycles. The next tick is only scheduled
 * after the current one returns, so ticks never overlap. A tick that throws is
 * reported to the error sink and the clock keeps going.
 */
public final class AdaptiveClock {
    static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofMinutes(2);

    private final PollIntervals intervals;
    private final ActiveWindow window;
    private final Clock clock;
    private final Runnable onTick;
    private final Consumer<RuntimeException> onError;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;
    private boolean running;
    private long generation;
    private volatile Thread tickThread;

    public AdaptiveClock(
            PollIntervals intervals,
            ActiveWindow window,
            Clock clock,
            Runnable onTick,
            Consumer<RuntimeException> onError
    ) {
        this.intervals = intervals;
        this.window = window;
        this.clock = clock;
        this.onTick = onTick;
        this.onError = onError;
    }

    public static boolean isActiveWindow(Instant now, ActiveWindow window) {
        int hour = now.atZone(window.zone()).getHour();
        return hour >= window.startHour() && hour < window.endHour();
    }

    public static long nextIntervalMs(Instant now, PollIntervals intervals, ActiveWindow window) {
        return isActiveWindow(now, window)
                ? intervals.active().toMillis()
                : intervals.inactive().toMillis();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        generation++;
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "maildigest-clock");
            thread.setDaemon(true);
            return thread;
        });
        scheduleNext(generation);
    }

    public boolean stop() {
        return stop(DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Cancels the pending tick and waits up to {@code timeout} for a tick
     * already in flight to finish. Called from the tick itself it does not
     * wait.
     *
     * @return {@code true} when no tick is running any more
     */
    public boolean stop(Duration timeout) {
        ScheduledExecutorService stopping;
        synchronized (this) {
            running = false;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            stopping = executor;
            executor = null;
        }
        if (stopping == null) {
            return true;
        }
        stopping.shutdown();
        if (Thread.currentThread() == tickThread) {
            return false;
        }
        try {
            return stopping.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private synchronized void scheduleNext(long owner) {
        // A tick from before a stop/start pair must not fork a second chain.
        if (!running || owner != generation) {
            return;
        }
        long delayMs = nextIntervalMs(clock.instant(), intervals, window);
        pending = executor.schedule(() -> tick(owner), delayMs, TimeUnit.MILLISECONDS);
    }

    private void tick(long owner) {
        tickThread = Thread.currentThread();
        try {
            onTick.run();
        } catch (RuntimeException e) {
            report(e);
        } catch (Error e) {
            report(new IllegalStateException("Tick failed: " + e, e));
        } finally {
            tickThread = null;
            scheduleNext(owner);
        }
    }

    private void report(RuntimeException e) {
        try {
            onError.accept(e);
        } catch (RuntimeException ignored) {
            // The sink failing must not stop the clock either.
        }
    }
}
