package io.courier.core.util;

/// Makes caller-supplied values safe to embed in a log line.
///
/// Cache keys come straight from request fields, so a key can carry line breaks that
/// forge log entries or be long enough to swamp the line. Pass such values through
/// {@link #sanitize(String)} before handing them to a logger:
/// ```
/// LOG.warnv(failure, "Cache write failed: {0}", LogSanitizer.sanitize(key));
/// ```
public final class LogSanitizer {

    /// Longest value kept verbatim; longer values are cut and suffixed with `...`.
    public static final int MAX_LENGTH = 256;

    private LogSanitizer() {}

    /// Drops line breaks, turns every other control character into a space and caps the
    /// length at {@link #MAX_LENGTH}.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder out = new StringBuilder(Math.min(value.length(), MAX_LENGTH + 3));
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\r' || c == '\n') {
                continue;
            }
            if (out.length() == MAX_LENGTH) {
                return out.append("...").toString();
            }
            out.append(Character.isISOControl(c) ? ' ' : c);
        }
        return out.toString();
    }
}
