package gr.imsi.athenarc.tsanalysis.exception;

import gr.imsi.athenarc.tsanalysis.domain.DateTimeUtil;

/**
 * Raised when a timestamp arrives at or before the latest stored timestamp and out-of-order
 * insertion is disabled.
 */
public class OutOfOrderException extends TimeSeriesException {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final long lastTimestamp;

    public OutOfOrderException(long timestamp, long lastTimestamp) {
        super("Timestamp " + DateTimeUtil.format(timestamp) + " (" + timestamp + ") is not after the last stored timestamp "
                + DateTimeUtil.format(lastTimestamp) + " (" + lastTimestamp + ")");
        this.timestamp = timestamp;
        this.lastTimestamp = lastTimestamp;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getLastTimestamp() {
        return lastTimestamp;
    }
}
