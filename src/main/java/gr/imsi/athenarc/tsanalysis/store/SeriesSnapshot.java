package gr.imsi.athenarc.tsanalysis.store;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.Provenance;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;

/**
 * An immutable, point-in-time view of a {@link TemporalSeriesStore}.
 * The backing arrays may be shared with the store; the store never writes to an index below
 * {@code size} of an array it has handed out.
 */
public final class SeriesSnapshot implements TimeSeries {

    private final long[] timestamps;
    private final double[] values;
    private final Provenance[] provenances;
    private final int size;
    private final SamplingInterval samplingInterval;

    SeriesSnapshot(long[] timestamps, double[] values, Provenance[] provenances, int size, SamplingInterval samplingInterval) {
        this.timestamps = timestamps;
        this.values = values;
        this.provenances = provenances;
        this.size = size;
        this.samplingInterval = samplingInterval;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Observation get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for series of size " + size);
        }
        return Observation.of(timestamps[index], values[index], provenances[index]);
    }

    @Override
    public Iterable<Observation> range(long start, long end) {
        // Bounds are resolved on every traversal so the iterable stays restartable
        return () -> {
            if (start >= end) {
                return new IndexIterator(0, 0);
            }
            return new IndexIterator(lowerBound(start), lowerBound(end));
        };
    }

    @Override
    public Optional<Observation> find(long timestamp) {
        int index = Arrays.binarySearch(timestamps, 0, size, timestamp);
        return index >= 0 ? Optional.of(get(index)) : Optional.empty();
    }

    @Override
    public Optional<SamplingInterval> getSamplingInterval() {
        return Optional.ofNullable(samplingInterval);
    }

    @Override
    public Iterator<Observation> iterator() {
        return new IndexIterator(0, size);
    }

    /**
     * Returns the index of the first slot with a timestamp {@code >= timestamp}.
     */
    int lowerBound(long timestamp) {
        int index = Arrays.binarySearch(timestamps, 0, size, timestamp);
        return index >= 0 ? index : -index - 1;
    }

    @Override
    public String toString() {
        return "SeriesSnapshot{size=" + size + ", samplingInterval=" + samplingInterval + '}';
    }

    private class IndexIterator implements Iterator<Observation> {
        private int next;
        private final int end;

        IndexIterator(int from, int end) {
            this.next = from;
            this.end = end;
        }

        @Override
        public boolean hasNext() {
            return next < end;
        }

        @Override
        public Observation next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more elements to iterate over");
            }
            return get(next++);
        }
    }
}
