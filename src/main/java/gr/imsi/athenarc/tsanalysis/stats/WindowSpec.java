package gr.imsi.athenarc.tsanalysis.stats;

import java.time.Duration;

/**
 * The extent of a rolling window: a fixed number of consecutive slots, or a fixed duration
 * covering {@code (t - duration, t]} for a window ending at {@code t}.
 */
public final class WindowSpec {

    private final int size;
    private final Duration duration;

    private WindowSpec(int size, Duration duration) {
        this.size = size;
        this.duration = duration;
    }

    public static WindowSpec ofCount(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Window size must be positive, got " + size);
        }
        return new WindowSpec(size, null);
    }

    public static WindowSpec ofDuration(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Window duration must be positive, got " + duration);
        }
        return new WindowSpec(0, duration);
    }

    public boolean isCountBased() {
        return duration == null;
    }

    public int getSize() {
        if (!isCountBased()) {
            throw new IllegalStateException("Window is duration based");
        }
        return size;
    }

    public Duration getDuration() {
        if (isCountBased()) {
            throw new IllegalStateException("Window is count based");
        }
        return duration;
    }

    @Override
    public String toString() {
        return isCountBased() ? "WindowSpec{" + size + " slots}" : "WindowSpec{" + duration + "}";
    }
}
