package gr.imsi.athenarc.tsanalysis.domain;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Represents the canonical step between consecutive slots of a regular series.
 */
public class SamplingInterval implements Comparable<SamplingInterval> {

    private final long multiplier;
    private final ChronoUnit chronoUnit;

    /**
     * @throws IllegalArgumentException unless the interval is an exact duration of at least one millisecond
     */
    private SamplingInterval(long multiplier, ChronoUnit chronoUnit) {
        Objects.requireNonNull(chronoUnit, "chronoUnit");
        if (multiplier <= 0) {
            throw new IllegalArgumentException("Sampling interval must be positive, got " + multiplier + " " + chronoUnit);
        }
        // Duration.of accepts DAYS as 24 hours but no other estimated unit
        if (chronoUnit.isDurationEstimated() && chronoUnit != ChronoUnit.DAYS) {
            throw new IllegalArgumentException("Sampling interval needs a unit of exact length, got " + chronoUnit);
        }
        long millis;
        try {
            millis = Duration.of(multiplier, chronoUnit).toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Sampling interval " + multiplier + " " + chronoUnit + " is too long", e);
        }
        if (millis < 1) {
            throw new IllegalArgumentException("Sampling interval must be at least 1 ms, got " + multiplier + " " + chronoUnit);
        }
        this.multiplier = multiplier;
        this.chronoUnit = chronoUnit;
    }

    public long getMultiplier() {
        return multiplier;
    }

    public ChronoUnit getChronoUnit() {
        return chronoUnit;
    }

    public Duration toDuration() {
        return Duration.of(multiplier, chronoUnit);
    }

    public long toMillis() {
        return toDuration().toMillis();
    }

    /**
     * Returns the timestamp {@code steps} intervals after {@code timestamp}.
     */
    public long advance(long timestamp, long steps) {
        return timestamp + steps * toMillis();
    }

    @Override
    public String toString() {
        return "SamplingInterval{" +
                multiplier +
                " " +
                chronoUnit +
                '}';
    }

    @Override
    public int compareTo(SamplingInterval o) {
        return Long.compare(this.toMillis(), o.toMillis());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SamplingInterval)) return false;
        return toMillis() == ((SamplingInterval) o).toMillis();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(toMillis());
    }

    public static SamplingInterval of(long multiplier, ChronoUnit chronoUnit) {
        return new SamplingInterval(multiplier, chronoUnit);
    }

    public static SamplingInterval fromMillis(long milliseconds) {
        return new SamplingInterval(milliseconds, ChronoUnit.MILLIS);
    }

    public static SamplingInterval of(Duration duration) {
        return fromMillis(duration.toMillis());
    }
}
