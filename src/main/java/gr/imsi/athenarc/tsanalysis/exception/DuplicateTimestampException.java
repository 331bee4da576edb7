package gr.imsi.athenarc.tsanalysis.exception;

import gr.imsi.athenarc.tsanalysis.domain.DateTimeUtil;

/**
 * Raised when a timestamp is inserted twice and no duplicate-resolution policy is configured.
 */
public class DuplicateTimestampException extends TimeSeriesException {

    private static final long serialVersionUID = 1L;

    private final long timestamp;

    public DuplicateTimestampException(long timestamp) {
        super("Duplicate timestamp " + DateTimeUtil.format(timestamp) + " (" + timestamp + ")");
        this.timestamp = timestamp;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
