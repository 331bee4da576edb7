package gr.imsi.athenarc.tsanalysis.domain;

/**
 * Represents a single univariate (timestamp, value) pair as handed to the core by a producer.
 */
public interface TimestampedValue {
    /**
     * Returns the timestamp (epoch time in milliseconds) of this pair.
     */
    long getTimestamp();

    /**
     * Returns the value recorded at {@code timestamp}.
     */
    double getValue();
}
