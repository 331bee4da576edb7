package gr.imsi.athenarc.tsanalysis.anomaly;

import java.util.List;

import gr.imsi.athenarc.tsanalysis.domain.Observation;
import gr.imsi.athenarc.tsanalysis.domain.StatSnapshot;
import gr.imsi.athenarc.tsanalysis.stats.StatisticsMode;

/**
 * What a rule may look at when scoring an observation: the window that ends immediately before it.
 * The observation under test is never part of its own context.
 */
public final class DetectionContext {

    private final StatSnapshot reference;
    private final List<Observation> windowSlots;
    private final StatisticsMode mode;

    public DetectionContext(StatSnapshot reference, List<Observation> windowSlots, StatisticsMode mode) {
        this.reference = reference;
        this.windowSlots = List.copyOf(windowSlots);
        this.mode = mode;
    }

    public StatSnapshot getReference() {
        return reference;
    }

    /**
     * Returns the slots of the reference window, oldest first, including the ones not counted by
     * the statistics mode. The tested observation sits at position {@code windowSlots.size()}.
     */
    public List<Observation> getWindowSlots() {
        return windowSlots;
    }

    public StatisticsMode getMode() {
        return mode;
    }
}
