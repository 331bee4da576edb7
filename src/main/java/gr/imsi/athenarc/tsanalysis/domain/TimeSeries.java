package gr.imsi.athenarc.tsanalysis.domain;

import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import gr.imsi.athenarc.tsanalysis.exception.NotFoundException;

/**
 * A read-only sequence of observations that can be traversed in time-ascending order.
 * Timestamps are strictly increasing and unique.
 */
public interface TimeSeries extends Iterable<Observation> {

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the observation at position {@code index} in time order.
     */
    Observation get(int index);

    /**
     * Returns the observations with {@code start <= timestamp < end}.
     * The returned iterable is lazy and can be traversed more than once. An empty or inverted
     * range yields an empty sequence.
     */
    Iterable<Observation> range(long start, long end);

    /**
     * Returns the observation at exactly {@code timestamp}.
     *
     * @throws NotFoundException if no observation has this timestamp
     */
    default Observation at(long timestamp) {
        return find(timestamp).orElseThrow(() -> new NotFoundException(timestamp));
    }

    Optional<Observation> find(long timestamp);

    /**
     * Returns the step between consecutive slots if this series is known to be regular.
     */
    Optional<SamplingInterval> getSamplingInterval();

    default long getFirstTimestamp() {
        if (isEmpty()) {
            throw new IllegalStateException("Series is empty");
        }
        return get(0).getTimestamp();
    }

    default long getLastTimestamp() {
        if (isEmpty()) {
            throw new IllegalStateException("Series is empty");
        }
        return get(size() - 1).getTimestamp();
    }

    default Stream<Observation> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    default int countPresent() {
        int count = 0;
        for (Observation observation : this) {
            if (observation.isPresent()) {
                count++;
            }
        }
        return count;
    }
}
