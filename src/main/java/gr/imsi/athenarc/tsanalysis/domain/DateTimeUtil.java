package gr.imsi.athenarc.tsanalysis.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timestamp formatting, duration parsing and sampling interval inference.
 */
public class DateTimeUtil {

    public static final ZoneId UTC = ZoneId.of("UTC");
    private static final String DEFAULT_FORMAT = "yyyy-MM-dd[ HH:mm:ss.SSS]";
    private static final DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern(DEFAULT_FORMAT);
    private static final Logger LOG = LoggerFactory.getLogger(DateTimeUtil.class);

    private DateTimeUtil() {
    }

    /**
     * Formats an epoch-millisecond timestamp in UTC, as used in log lines and error messages.
     */
    public static String format(final long timeStamp) {
        return Instant.ofEpochMilli(timeStamp)
                .atZone(UTC)
                .format(DEFAULT_FORMATTER);
    }

    /**
     * Parses a duration such as {@code 15m}, {@code 2h}, {@code 1d}, {@code 500ms} or an ISO-8601
     * duration ({@code PT15M}).
     *
     * @param s the text to parse
     * @return the parsed duration
     * @throws IllegalArgumentException if the text is not a positive duration
     */
    public static Duration parseDuration(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Duration must not be empty");
        }
        String text = s.trim().toLowerCase(Locale.ROOT);
        Duration duration;
        try {
            if (text.startsWith("p")) {
                duration = Duration.parse(text.toUpperCase(Locale.ROOT));
            } else if (text.endsWith("ms")) {
                duration = Duration.of(Long.parseLong(text.substring(0, text.length() - 2)), ChronoUnit.MILLIS);
            } else {
                long amount = Long.parseLong(text.substring(0, text.length() - 1));
                switch (text.charAt(text.length() - 1)) {
                    case 's':
                        duration = Duration.ofSeconds(amount);
                        break;
                    case 'm':
                        duration = Duration.ofMinutes(amount);
                        break;
                    case 'h':
                        duration = Duration.ofHours(amount);
                        break;
                    case 'd':
                        duration = Duration.ofDays(amount);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown duration unit in '" + s + "'");
                }
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Cannot parse duration '" + s + "'", e);
        }
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Duration must be positive, got '" + s + "'");
        }
        return duration;
    }

    /**
     * Infers the sampling interval of a series as the median spacing between consecutive timestamps.
     *
     * @param series the series to inspect
     * @return the median spacing, or empty if the series has fewer than 2 slots
     */
    public static Optional<SamplingInterval> inferSamplingInterval(TimeSeries series) {
        int size = series.size();
        if (size < 2) {
            return Optional.empty();
        }
        long[] spacings = new long[size - 1];
        long previous = series.get(0).getTimestamp();
        for (int i = 1; i < size; i++) {
            long current = series.get(i).getTimestamp();
            spacings[i - 1] = current - previous;
            previous = current;
        }
        Arrays.sort(spacings);
        long median = spacings[spacings.length / 2];
        LOG.debug("Inferred sampling interval of {} ms from {} spacings", median, spacings.length);
        return Optional.of(SamplingInterval.fromMillis(median));
    }
}
