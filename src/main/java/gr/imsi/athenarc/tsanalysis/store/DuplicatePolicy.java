package gr.imsi.athenarc.tsanalysis.store;

/** How a store resolves a second value for a timestamp it already holds. */
public enum DuplicatePolicy {
    REJECT,       // Fail with DuplicateTimestampException
    KEEP_FIRST,   // Keep the value already stored
    KEEP_LAST,    // Replace it with the new value
    AVERAGE,      // Running mean of every value seen for the timestamp
}
