package gr.imsi.athenarc.tsanalysis.stats;

import gr.imsi.athenarc.tsanalysis.domain.Observation;

/**
 * Selects which slots contribute values to window aggregates. Missing slots never do.
 */
public enum StatisticsMode {
    /** Only observed values, imputed slots are treated like missing ones. */
    RAW,
    /** Observed and imputed values. */
    FILLED;

    public boolean counts(Observation observation) {
        switch (this) {
            case RAW:
                return observation.isObserved();
            case FILLED:
                return observation.isPresent();
            default:
                throw new IllegalStateException("Unknown statistics mode " + this);
        }
    }
}
