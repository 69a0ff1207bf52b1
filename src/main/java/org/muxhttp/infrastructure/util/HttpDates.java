package org.muxhttp.infrastructure.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * IMF-fixdate helpers ({@code Sun, 06 Nov 1994 08:49:37 GMT}).
 * <p>
 * Parsing ignores the day-of-week token: clients routinely send dates whose weekday
 * does not match, and the date itself is still unambiguous.
 */
public final class HttpDates {

    /** Two-digit day; {@link DateTimeFormatter#RFC_1123_DATE_TIME} would print "6 Nov". */
    private static final DateTimeFormatter FIXDATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    private static final DateTimeFormatter DATE_PART =
            DateTimeFormatter.ofPattern("d MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    private HttpDates() {}

    public static String format(Instant t) {
        return FIXDATE.format(t.atOffset(ZoneOffset.UTC));
    }

    /** @return the instant, or null when the value is not an IMF-fixdate */
    public static Instant parseOrNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        int comma = v.indexOf(',');
        if (comma >= 0) v = v.substring(comma + 1).trim();
        try {
            return LocalDateTime.parse(v, DATE_PART).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
