package com.cityhive.validation;

import java.util.Locale;

/** Normalizes raw request strings before they reach validation. */
public final class InputSanitizer {

    private InputSanitizer() {
        // utility class
    }

    /** Trims surrounding whitespace; null becomes the empty string. */
    public static String sanitizeString(String value) {
        return value == null ? "" : value.strip();
    }

    /** Trims and lower-cases an e-mail address; null becomes the empty string. */
    public static String sanitizeEmail(String value) {
        return sanitizeString(value).toLowerCase(Locale.ROOT);
    }

    /** Trims an optional free-text field and maps empty input to null. */
    public static String emptyToNull(String value) {
        String sanitized = sanitizeString(value);
        return sanitized.isEmpty() ? null : sanitized;
    }
}
