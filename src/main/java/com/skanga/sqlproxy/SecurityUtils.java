package com.skanga.sqlproxy;

import java.util.regex.Pattern;

/**
 * Helpers that keep connection details and driver internals out of logs and responses.
 */
public final class SecurityUtils {
    private static final Pattern JDBC_URL = Pattern.compile("(?i)\\bjdbc:[^\\s\"']+");
    private static final Pattern LIBPQ_URL = Pattern.compile("(?i)\\bpostgres(?:ql)?(?:\\+\\w+)?://[^\\s\"']+");
    private static final Pattern USER_INFO = Pattern.compile("//[^/@\\s]+@");
    private static final Pattern PASSWORD_PARAM = Pattern.compile("(?i)(password|pwd)=[^;&\\s]*");
    // H2 appends "[<error code>-<build>]" to every message
    private static final Pattern H2_ERROR_SUFFIX = Pattern.compile("\\s*\\[\\d{5}-\\d+]\\s*$");
    private static final Pattern SEVERITY_PREFIX = Pattern.compile("^(?:ERROR|FATAL|PANIC):\\s*");
    private static final int MAX_MESSAGE_LENGTH = 500;

    private SecurityUtils() {
    }

    /**
     * Reduces a raw driver message to something safe to show a client.
     * Only the first line is kept; statement echoes, connection URLs and driver error suffixes are removed.
     *
     * @param rawMessage Message from a {@link java.sql.SQLException}
     * @return A single-line message, never null
     */
    public static String sanitizeDriverMessage(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            return "unknown database error";
        }
        String sanitized = rawMessage.strip();
        int lineEnd = sanitized.indexOf('\n');
        if (lineEnd >= 0) {
            sanitized = sanitized.substring(0, lineEnd);
        }
        int statementEcho = sanitized.indexOf("; SQL statement:");
        if (statementEcho >= 0) {
            sanitized = sanitized.substring(0, statementEcho);
        }
        sanitized = H2_ERROR_SUFFIX.matcher(sanitized).replaceAll("");
        sanitized = SEVERITY_PREFIX.matcher(sanitized).replaceFirst("");
        sanitized = JDBC_URL.matcher(sanitized).replaceAll("<url>");
        sanitized = LIBPQ_URL.matcher(sanitized).replaceAll("<url>");
        sanitized = sanitized.strip();
        if (sanitized.length() > MAX_MESSAGE_LENGTH) {
            sanitized = sanitized.substring(0, MAX_MESSAGE_LENGTH) + "...";
        }
        return sanitized.isEmpty() ? "unknown database error" : sanitized;
    }

    /**
     * Masks user-info and password parameters inside a connection URL.
     */
    public static String maskUrl(String connectionUrl) {
        if (connectionUrl == null) {
            return null;
        }
        String masked = PASSWORD_PARAM.matcher(connectionUrl).replaceAll("$1=***");
        return USER_INFO.matcher(masked).replaceAll("//***@");
    }

    /**
     * Shortens query text for log lines.
     */
    public static String truncateForLog(String sqlText, int maxLength) {
        if (sqlText == null) {
            return null;
        }
        String singleLine = sqlText.replaceAll("\\s+", " ").strip();
        return singleLine.length() > maxLength ? singleLine.substring(0, maxLength) + "..." : singleLine;
    }
}
