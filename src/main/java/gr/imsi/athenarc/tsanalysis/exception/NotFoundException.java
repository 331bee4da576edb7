package gr.imsi.athenarc.tsanalysis.exception;

import gr.imsi.athenarc.tsanalysis.domain.DateTimeUtil;

public class NotFoundException extends TimeSeriesException {

    private static final long serialVersionUID = 1L;

    private final long timestamp;

    public NotFoundException(long timestamp) {
        super("No observation at " + DateTimeUtil.format(timestamp) + " (" + timestamp + ")");
        this.timestamp = timestamp;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
