package gr.imsi.athenarc.tsanalysis.domain;

/** Where the value of an observation slot came from. */
public enum Provenance {
    OBSERVED,   // Value recorded by the producer
    IMPUTED,    // Gap slot filled by the resampler
    MISSING;    // Gap slot left unfilled, carries no value

    public boolean isPresent() {
        return this != MISSING;
    }
}
