package defiautomation.signer.util;

import java.util.regex.Pattern;

/**
 * Keeps caller-supplied values and key material references safe for logging.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}+");
    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final int MAX_LENGTH = 200;

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Replaces runs of control characters (newlines, escapes, NUL) with a
     * single underscore and truncates oversized values such as intent payload
     * fields.
     *
     * @param value caller provided value
     * @return sanitized value, never null
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("_");
        if (cleaned.length() <= MAX_LENGTH) {
            return cleaned;
        }
        return cleaned.substring(0, MAX_LENGTH) + "...(" + cleaned.length() + " chars)";
    }

    /**
     * Shortens wallet addresses, key ids, wallet ids and owner references.
     * Addresses keep {@code 0x} and four hex digits at each end. KMS key ARNs
     * are cut down to the trailing key id before masking.
     *
     * @param identifier sensitive identifier
     * @return masked representation, never null
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (ADDRESS.matcher(sanitized).matches()) {
            return sanitized.substring(0, 6) + "..." + sanitized.substring(38);
        }
        String id = sanitized.startsWith("arn:") ? sanitized.substring(sanitized.lastIndexOf('/') + 1) : sanitized;
        if (id.length() <= 4) {
            return "***";
        }
        if (id.length() <= 8) {
            return id.charAt(0) + "***";
        }
        return id.substring(0, 4) + "..." + id.substring(id.length() - 4);
    }

    /**
     * Message of a throwable, sanitized, falling back to the exception class name.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : sanitize(message);
    }
}
