package gr.imsi.athenarc.tsanalysis.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.StatSnapshot;
import gr.imsi.athenarc.tsanalysis.domain.TimeSeries;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Produces a {@link StatSnapshot} for every valid window end of a series.
 * <p>
 * Count windows are valid once they hold {@code size} slots; duration windows are reported at every
 * slot, the leading ones covering less history. Missing slots, and imputed ones in {@link StatisticsMode#RAW},
 * occupy window span but are not counted.
 */
public class RollingStatisticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RollingStatisticsEngine.class);

    public static final double[] DEFAULT_QUANTILES = {0.25, 0.5, 0.75};

    private final WindowSpec windowSpec;
    private final StatisticsMode mode;
    private final double[] quantileProbabilities;

    public RollingStatisticsEngine(WindowSpec windowSpec) {
        this(windowSpec, StatisticsMode.RAW, DEFAULT_QUANTILES);
    }

    public RollingStatisticsEngine(WindowSpec windowSpec, StatisticsMode mode, double[] quantileProbabilities) {
        if (windowSpec == null || mode == null) {
            throw new IllegalArgumentException("Window spec and statistics mode are required");
        }
        for (double p : quantileProbabilities) {
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new IllegalArgumentException("Quantile probability must be in [0, 1], got " + p);
            }
        }
        this.windowSpec = windowSpec;
        this.mode = mode;
        this.quantileProbabilities = quantileProbabilities.clone();
        Arrays.sort(this.quantileProbabilities);
    }

    /**
     * Computes the snapshots of every valid window end of {@code series}, in time order.
     */
    public List<StatSnapshot> compute(TimeSeries series) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        ImmutableList.Builder<StatSnapshot> snapshots = ImmutableList.builder();
        WindowCursor cursor = newCursor();
        int produced = 0;
        for (Observation observation : series) {
            cursor.advance(observation);
            Optional<StatSnapshot> snapshot = cursor.current();
            if (snapshot.isPresent()) {
                snapshots.add(snapshot.get());
                produced++;
            }
        }
        LOG.debug("Computed {} snapshots over {} slots with {} in {}", produced, series.size(), windowSpec, stopwatch.stop());
        return snapshots.build();
    }

    /**
     * Computes the snapshot of a single window holding {@code values}.
     */
    public static StatSnapshot snapshotOf(long timestamp, double[] values, double[] quantileProbabilities) {
        RollingWindow window = new RollingWindow();
        for (double value : values) {
            window.add(value);
        }
        double[] probabilities = quantileProbabilities.clone();
        Arrays.sort(probabilities);
        return window.snapshot(timestamp, probabilities);
    }

    /**
     * Creates a cursor that slides this engine's window one slot at a time.
     */
    public WindowCursor newCursor() {
        return new WindowCursor();
    }

    public WindowSpec getWindowSpec() {
        return windowSpec;
    }

    public StatisticsMode getMode() {
        return mode;
    }

    public double[] getQuantileProbabilities() {
        return quantileProbabilities.clone();
    }

    /**
     * Incremental traversal of a series: each {@link #advance(Observation)} admits the next slot and
     * evicts the slots that fell out of the window.
     */
    public class WindowCursor {

        private final Deque<Observation> slots = new ArrayDeque<>();
        private final RollingWindow window = new RollingWindow();
        private long lastTimestamp = Long.MIN_VALUE;
        private int admitted;

        public void advance(Observation observation) {
            if (admitted > 0 && observation.getTimestamp() <= lastTimestamp) {
                throw new IllegalArgumentException("Slots must be offered in increasing time order, got "
                        + observation.getTimestamp() + " after " + lastTimestamp);
            }
            slots.addLast(observation);
            if (mode.counts(observation)) {
                window.add(observation.getValue());
            }
            lastTimestamp = observation.getTimestamp();
            admitted++;

            if (windowSpec.isCountBased()) {
                while (slots.size() > windowSpec.getSize()) {
                    evict(slots.removeFirst());
                }
            } else {
                long horizon = lastTimestamp - windowSpec.getDuration().toMillis();
                while (slots.peekFirst().getTimestamp() <= horizon) {
                    evict(slots.removeFirst());
                }
            }
        }

        private void evict(Observation observation) {
            if (mode.counts(observation)) {
                window.remove(observation.getValue());
            }
        }

        /**
         * Returns the snapshot of the window ending at the last admitted slot, or empty while no
         * valid window end has been reached.
         */
        public Optional<StatSnapshot> current() {
            if (admitted == 0) {
                return Optional.empty();
            }
            if (windowSpec.isCountBased() && slots.size() < windowSpec.getSize()) {
                return Optional.empty();
            }
            return Optional.of(window.snapshot(lastTimestamp, quantileProbabilities));
        }

        /**
         * Returns the slots currently spanned by the window, oldest first, including uncounted ones.
         */
        public List<Observation> windowSlots() {
            return ImmutableList.copyOf(slots);
        }

        /**
         * Returns the number of counted values in the window.
         */
        public int countedValues() {
            return window.getCount();
        }

        public int admittedSlots() {
            return admitted;
        }
    }
}
