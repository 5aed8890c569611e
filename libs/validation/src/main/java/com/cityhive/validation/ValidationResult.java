package com.cityhive.validation;

/**
 * Result of a single field check.
 *
 * @param valid true if the check passed
 * @param errorMessage human-readable reason for the failure (null when valid)
 */
public record ValidationResult(boolean valid, String errorMessage) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public ValidationResult {
        if (valid && errorMessage != null) {
            throw new IllegalArgumentException("a passing result carries no error message");
        }
        if (!valid && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("a failing result requires an error message");
        }
    }

    /** Convenience factory for a successful check. */
    public static ValidationResult ok() {
        return OK;
    }

    /** Convenience factory for a failed check. */
    public static ValidationResult fail(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }
}
