package gr.imsi.athenarc.tsanalysis.store;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.Provenance;
import gr.imsi.athenarc.tsanalysis.domain.SamplingInterval;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;
import gr.imsi.athenarc.tsanalysis.domain.TimestampedValue;
import gr.imsi.athenarc.tsanalysis.exception.DuplicateTimestampException;
import gr.imsi.athenarc.tsanalysis.exception.OutOfOrderException;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * An ordered, time-indexed container of observations.
 * <p>
 * In-order appends go to a sorted array segment (amortized O(1)). When out-of-order insertion is
 * enabled, late timestamps go to a sorted overflow index (O(log n)) that is merged into the array
 * segment once it grows past a threshold or when a snapshot is requested. Lookups by timestamp
 * binary-search the array segment and probe the overflow index.
 * <p>
 * Writers are serialized with a write lock. Readers that need a consistent view of many slots use
 * {@link #snapshot()}; once a snapshot has been handed out, any in-place change copies the arrays first.
 */
public class TemporalSeriesStore implements TimeSeries {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalSeriesStore.class);

    private static final int DEFAULT_CAPACITY = 16;
    private static final int MIN_COMPACTION_THRESHOLD = 64;

    private final DuplicatePolicy duplicatePolicy;
    private final boolean allowOutOfOrder;
    private final SamplingInterval samplingInterval;
    private final ReadWriteLock lock;

    private long[] timestamps;
    private double[] values;
    private Provenance[] provenances;
    private int[] counts;
    private int mainSize;

    // Timestamps below the last array timestamp that arrived late
    private final TreeMap<Long, Slot> overflow;

    // True while the current arrays back a snapshot handed to a reader
    private boolean shared;
    private SeriesSnapshot cachedSnapshot;

    private TemporalSeriesStore(Builder builder) {
        this.duplicatePolicy = builder.duplicatePolicy;
        this.allowOutOfOrder = builder.allowOutOfOrder;
        this.samplingInterval = builder.samplingInterval;
        this.lock = new ReentrantReadWriteLock();
        this.timestamps = new long[builder.initialCapacity];
        this.values = new double[builder.initialCapacity];
        this.provenances = new Provenance[builder.initialCapacity];
        this.counts = new int[builder.initialCapacity];
        this.overflow = new TreeMap<>();
    }

    /**
     * Creates a store that rejects duplicates and out-of-order timestamps.
     */
    public static TemporalSeriesStore create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a strict store holding the given pairs.
     *
     * @param pairs time-ordered pairs
     * @return a new store
     */
    public static TemporalSeriesStore of(Iterable<? extends TimestampedValue> pairs) {
        TemporalSeriesStore store = create();
        store.insertAll(pairs);
        return store;
    }

    /**
     * Inserts an observed value.
     *
     * @param timestamp epoch milliseconds
     * @param value a finite value
     * @throws IllegalArgumentException if the value is NaN or infinite
     * @throws DuplicateTimestampException if the timestamp exists and duplicates are rejected
     * @throws OutOfOrderException if the timestamp precedes the last one and out-of-order insertion is disabled
     */
    public void insert(long timestamp, double value) {
        insert(Observation.observed(timestamp, value));
    }

    /**
     * Inserts an observation keeping its provenance.
     *
     * @param observation the observation to insert
     */
    public void insert(@NotNull Observation observation) {
        if (observation.isPresent() && !Double.isFinite(observation.getValue())) {
            throw new IllegalArgumentException("Value at " + observation.getTimestamp() + " must be finite, got " + observation.getValue());
        }
        long timestamp = observation.getTimestamp();
        try {
            lock.writeLock().lock();
            int index = Arrays.binarySearch(timestamps, 0, mainSize, timestamp);
            if (index >= 0) {
                resolveDuplicateInArray(index, observation);
                return;
            }
            Slot late = overflow.get(timestamp);
            if (late != null) {
                Slot resolved = resolveDuplicate(late, observation);
                if (resolved != late) {
                    overflow.put(timestamp, resolved);
                    cachedSnapshot = null;
                }
                return;
            }
            if (mainSize == 0 || timestamp > timestamps[mainSize - 1]) {
                append(observation);
            } else if (!allowOutOfOrder) {
                throw new OutOfOrderException(timestamp, timestamps[mainSize - 1]);
            } else {
                overflow.put(timestamp, new Slot(observation.isPresent() ? observation.getValue() : Double.NaN,
                        observation.getProvenance(), 1));
                if (overflow.size() > compactionThreshold()) {
                    compact();
                }
            }
            cachedSnapshot = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Inserts every pair in iteration order. {@link Observation} instances keep their provenance,
     * any other pair is inserted as observed.
     *
     * @param pairs the pairs to insert
     * @return the number of pairs consumed
     * @throws IllegalArgumentException naming the position of the first malformed pair
     */
    public int insertAll(Iterable<? extends TimestampedValue> pairs) {
        int consumed = 0;
        for (TimestampedValue pair : pairs) {
            if (pair == null) {
                throw new IllegalArgumentException("Pair #" + consumed + " is null");
            }
            try {
                if (pair instanceof Observation) {
                    insert((Observation) pair);
                } else {
                    insert(pair.getTimestamp(), pair.getValue());
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Pair #" + consumed + " rejected: " + e.getMessage(), e);
            }
            consumed++;
        }
        LOG.debug("Inserted {} pairs, store now holds {} observations", consumed, size());
        return consumed;
    }

    /**
     * Returns a point-in-time view of the store. Later writes are never visible through it.
     */
    public SeriesSnapshot snapshot() {
        try {
            lock.readLock().lock();
            if (cachedSnapshot != null) {
                return cachedSnapshot;
            }
        } finally {
            lock.readLock().unlock();
        }
        try {
            lock.writeLock().lock();
            if (cachedSnapshot == null) {
                if (!overflow.isEmpty()) {
                    compact();
                }
                cachedSnapshot = new SeriesSnapshot(timestamps, values, provenances, mainSize, samplingInterval);
                shared = true;
            }
            return cachedSnapshot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        try {
            lock.readLock().lock();
            return mainSize + overflow.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Observation get(int index) {
        return snapshot().get(index);
    }

    @Override
    public Iterable<Observation> range(long start, long end) {
        return snapshot().range(start, end);
    }

    @Override
    public Optional<Observation> find(long timestamp) {
        try {
            lock.readLock().lock();
            int index = Arrays.binarySearch(timestamps, 0, mainSize, timestamp);
            if (index >= 0) {
                return Optional.of(Observation.of(timestamps[index], values[index], provenances[index]));
            }
            Slot late = overflow.get(timestamp);
            return late == null ? Optional.empty() : Optional.of(Observation.of(timestamp, late.value, late.provenance));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long getLastTimestamp() {
        try {
            lock.readLock().lock();
            if (mainSize == 0) {
                throw new IllegalStateException("Series is empty");
            }
            // Late arrivals are always below the last array timestamp
            return timestamps[mainSize - 1];
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<SamplingInterval> getSamplingInterval() {
        return Optional.ofNullable(samplingInterval);
    }

    @Override
    public Iterator<Observation> iterator() {
        return snapshot().iterator();
    }

    private void append(Observation observation) {
        ensureCapacity(mainSize + 1);
        timestamps[mainSize] = observation.getTimestamp();
        values[mainSize] = observation.isPresent() ? observation.getValue() : Double.NaN;
        provenances[mainSize] = observation.getProvenance();
        counts[mainSize] = 1;
        mainSize++;
    }

    private void resolveDuplicateInArray(int index, Observation observation) {
        Slot existing = new Slot(values[index], provenances[index], counts[index]);
        Slot resolved = resolveDuplicate(existing, observation);
        if (resolved == existing) {
            return;
        }
        ensureWritable();
        values[index] = resolved.value;
        provenances[index] = resolved.provenance;
        counts[index] = resolved.count;
        cachedSnapshot = null;
    }

    /**
     * Applies the duplicate policy. Returns {@code existing} itself when nothing changes.
     */
    private Slot resolveDuplicate(Slot existing, Observation incoming) {
        switch (duplicatePolicy) {
            case KEEP_FIRST:
                return existing;
            case KEEP_LAST:
                return new Slot(incoming.isPresent() ? incoming.getValue() : Double.NaN, incoming.getProvenance(), 1);
            case AVERAGE:
                if (!incoming.isPresent()) {
                    return existing;
                }
                if (!existing.provenance.isPresent()) {
                    return new Slot(incoming.getValue(), incoming.getProvenance(), 1);
                }
                int count = existing.count + 1;
                double mean = existing.value + (incoming.getValue() - existing.value) / count;
                Provenance provenance = existing.provenance == Provenance.OBSERVED || incoming.isObserved()
                        ? Provenance.OBSERVED : Provenance.IMPUTED;
                return new Slot(mean, provenance, count);
            case REJECT:
            default:
                throw new DuplicateTimestampException(incoming.getTimestamp());
        }
    }

    private void ensureCapacity(int required) {
        if (required <= timestamps.length) {
            return;
        }
        int capacity = Math.max(required, timestamps.length + (timestamps.length >> 1) + 1);
        timestamps = Arrays.copyOf(timestamps, capacity);
        values = Arrays.copyOf(values, capacity);
        provenances = Arrays.copyOf(provenances, capacity);
        counts = Arrays.copyOf(counts, capacity);
        shared = false;
    }

    private void ensureWritable() {
        if (!shared) {
            return;
        }
        timestamps = timestamps.clone();
        values = values.clone();
        provenances = provenances.clone();
        counts = counts.clone();
        shared = false;
    }

    private int compactionThreshold() {
        return Math.max(MIN_COMPACTION_THRESHOLD, mainSize >> 3);
    }

    /**
     * Merges the overflow index into freshly allocated arrays.
     */
    private void compact() {
        int total = mainSize + overflow.size();
        int capacity = Math.max(DEFAULT_CAPACITY, total + (total >> 1));
        long[] mergedTimestamps = new long[capacity];
        double[] mergedValues = new double[capacity];
        Provenance[] mergedProvenances = new Provenance[capacity];
        int[] mergedCounts = new int[capacity];

        Iterator<Map.Entry<Long, Slot>> late = overflow.entrySet().iterator();
        Map.Entry<Long, Slot> next = late.hasNext() ? late.next() : null;
        int i = 0;
        int out = 0;
        while (i < mainSize || next != null) {
            if (next == null || (i < mainSize && timestamps[i] < next.getKey())) {
                mergedTimestamps[out] = timestamps[i];
                mergedValues[out] = values[i];
                mergedProvenances[out] = provenances[i];
                mergedCounts[out] = counts[i];
                i++;
            } else {
                mergedTimestamps[out] = next.getKey();
                mergedValues[out] = next.getValue().value;
                mergedProvenances[out] = next.getValue().provenance;
                mergedCounts[out] = next.getValue().count;
                next = late.hasNext() ? late.next() : null;
            }
            out++;
        }
        LOG.debug("Compacted {} late observations into {} slots", overflow.size(), total);
        timestamps = mergedTimestamps;
        values = mergedValues;
        provenances = mergedProvenances;
        counts = mergedCounts;
        mainSize = total;
        overflow.clear();
        shared = false;
    }

    @Override
    public String toString() {
        return "TemporalSeriesStore{size=" + size() + ", duplicatePolicy=" + duplicatePolicy
                + ", allowOutOfOrder=" + allowOutOfOrder + ", samplingInterval=" + samplingInterval + '}';
    }

    private static final class Slot {
        private final double value;
        private final Provenance provenance;
        private final int count;

        private Slot(double value, Provenance provenance, int count) {
            this.value = value;
            this.provenance = provenance;
            this.count = count;
        }
    }

    public static class Builder {
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.REJECT;
        private boolean allowOutOfOrder = false;
        private SamplingInterval samplingInterval;
        private int initialCapacity = DEFAULT_CAPACITY;

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder allowOutOfOrder(boolean allowOutOfOrder) {
            this.allowOutOfOrder = allowOutOfOrder;
            return this;
        }

        public Builder samplingInterval(SamplingInterval samplingInterval) {
            this.samplingInterval = samplingInterval;
            return this;
        }

        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public TemporalSeriesStore build() {
            if (duplicatePolicy == null) {
                throw new IllegalArgumentException("Duplicate policy must not be null");
            }
            if (initialCapacity < 1) {
                throw new IllegalArgumentException("Initial capacity must be positive, got " + initialCapacity);
            }
            return new TemporalSeriesStore(this);
        }
    }
}
