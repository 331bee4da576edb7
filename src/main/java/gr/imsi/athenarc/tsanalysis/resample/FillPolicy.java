package gr.imsi.athenarc.tsanalysis.resample;

/** How the resampler treats grid slots that received no present observation. */
public enum FillPolicy {
    NONE,                // Leave the slot missing
    FORWARD_FILL,        // Repeat the last present value
    LINEAR_INTERPOLATE,  // Interpolate between the surrounding present values
    ZERO_FILL,           // Fill with zero
}
