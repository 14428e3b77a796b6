package io.maestro.server.validation;

/// Strips control characters from strings to prevent log injection.
///
/// Log injection occurs when user-controlled input containing newline
/// characters ({@code \r}, {@code \n}) is written to log output,
/// allowing attackers to forge log entries. Chat messages and goals can be long, so
/// values are also cut at {@link #MAX_LENGTH} characters.
///
/// Apply to any user-derived value before passing it to a logger:
/// ```
/// LOG.infov("Processing goal: {0}", LogSanitizer.sanitize(goal));
/// ```
public final class LogSanitizer {

    /// Longest value written to the log; longer values end with `...`.
    public static final int MAX_LENGTH = 200;

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters and truncates the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        String cleaned = value.replace("\r", "").replace("\n", "");
        if (cleaned.length() > MAX_LENGTH) {
            return cleaned.substring(0, MAX_LENGTH) + "...";
        }
        return cleaned;
    }
}
