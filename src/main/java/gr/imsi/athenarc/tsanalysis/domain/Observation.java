package gr.imsi.athenarc.tsanalysis.domain;

import java.util.Objects;

/**
 * An immutable slot of a time series: a timestamp, a value and the provenance of that value.
 * A {@link Provenance#MISSING} observation holds no value.
 */
public final class Observation implements TimestampedValue {

    private final long timestamp;

    private final double value;

    private final Provenance provenance;

    private Observation(final long timestamp, final double value, final Provenance provenance) {
        this.timestamp = timestamp;
        this.value = value;
        this.provenance = provenance;
    }

    public static Observation observed(long timestamp, double value) {
        return new Observation(timestamp, value, Provenance.OBSERVED);
    }

    public static Observation imputed(long timestamp, double value) {
        return new Observation(timestamp, value, Provenance.IMPUTED);
    }

    public static Observation missing(long timestamp) {
        return new Observation(timestamp, Double.NaN, Provenance.MISSING);
    }

    public static Observation of(long timestamp, double value, Provenance provenance) {
        if (provenance == Provenance.MISSING) {
            return missing(timestamp);
        }
        return new Observation(timestamp, value, provenance);
    }

    @Override
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Returns the value of this slot.
     *
     * @throws IllegalStateException if the slot is missing
     */
    @Override
    public double getValue() {
        if (provenance == Provenance.MISSING) {
            throw new IllegalStateException("Observation at " + DateTimeUtil.format(timestamp) + " is missing");
        }
        return value;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public boolean isPresent() {
        return provenance.isPresent();
    }

    public boolean isObserved() {
        return provenance == Provenance.OBSERVED;
    }

    public boolean isImputed() {
        return provenance == Provenance.IMPUTED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation)) return false;
        Observation that = (Observation) o;
        return timestamp == that.timestamp
                && provenance == that.provenance
                && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, provenance);
    }

    @Override
    public String toString() {
        return "{" + timestamp + ", " + DateTimeUtil.format(timestamp) +
                ", " + (isPresent() ? String.valueOf(value) : "-") +
                ", " + provenance +
                '}';
    }
}
