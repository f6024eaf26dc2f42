package redlet.utils;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Monotonic millisecond clock for key expiry. Readings have an arbitrary
 * origin and only differences between them mean anything; wall clock
 * adjustments do not move it.
 */
public final class Time {

    /** Source of monotonic nanoseconds. Tests install their own. */
    public interface Clock {
        long nanoTime();
    }

    private static final Clock MONOTONIC = System::nanoTime;
    private static final AtomicReference<Clock> source = new AtomicReference<>(MONOTONIC);

    private Time() { }

    public static long now() {
        return TimeUnit.NANOSECONDS.toMillis(source.get().nanoTime());
    }

    public static void setClock(Clock clock) {
        source.set(clock);
    }

    public static void useSystemClock() {
        source.set(MONOTONIC);
    }
}
