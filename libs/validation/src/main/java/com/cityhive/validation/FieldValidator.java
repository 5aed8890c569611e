package com.cityhive.validation;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Email;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/**
 * Pure field checks used before any entity is built.
 *
 * <p>No check throws for malformed input. Malformed input is the condition under test, so it is
 * classified and reported as a failed {@link ValidationResult}.
 *
 * <p>Coordinate checks accept {@code Object} because values may arrive untyped from a request
 * body: numbers, numeric strings, or anything else. Only finite numbers count as numeric.
 */
public final class FieldValidator {

    public static final String EMAIL_REQUIRED = "Email is required";
    public static final String EMAIL_INVALID = "Invalid email format";
    public static final String LATITUDE_NOT_A_NUMBER = "Latitude must be a valid number";
    public static final String LATITUDE_OUT_OF_RANGE = "Latitude must be between -90 and 90 degrees";
    public static final String LONGITUDE_NOT_A_NUMBER = "Longitude must be a valid number";
    public static final String LONGITUDE_OUT_OF_RANGE =
            "Longitude must be between -180 and 180 degrees";
    public static final String COORDINATES_INCOMPLETE =
            "Both latitude and longitude must be provided together";

    private static final double MAX_LATITUDE = 90.0;
    private static final double MAX_LONGITUDE = 180.0;

    // ParameterMessageInterpolator keeps this module free of an Expression Language runtime.
    private static final Validator EMAIL_VALIDATOR = buildValidator();

    private FieldValidator() {
        // utility class
    }

    /**
     * Fails when the value is null or blank after trimming.
     *
     * @param value the raw field value
     * @param fieldName display name used in the message, e.g. {@code "Name"}
     */
    public static ValidationResult validateRequired(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            return ValidationResult.fail(fieldName + " is required");
        }
        return ValidationResult.ok();
    }

    /**
     * Checks RFC 5322 address shape. Validator-specific detail is collapsed to one of two fixed
     * messages.
     */
    public static ValidationResult validateEmail(String email) {
        if (email == null || email.isEmpty()) {
            return ValidationResult.fail(EMAIL_REQUIRED);
        }
        try {
            boolean wellFormed =
                    EMAIL_VALIDATOR.validateValue(EmailAddress.class, "value", email).isEmpty()
                            && email.indexOf('@') > 0;
            return wellFormed ? ValidationResult.ok() : ValidationResult.fail(EMAIL_INVALID);
        } catch (RuntimeException e) {
            return ValidationResult.fail(EMAIL_INVALID);
        }
    }

    /** Null is valid (optional field); otherwise a finite number in [-90, 90]. */
    public static ValidationResult validateLatitude(Object latitude) {
        return validateDegrees(latitude, MAX_LATITUDE, LATITUDE_NOT_A_NUMBER, LATITUDE_OUT_OF_RANGE);
    }

    /** Null is valid (optional field); otherwise a finite number in [-180, 180]. */
    public static ValidationResult validateLongitude(Object longitude) {
        return validateDegrees(
                longitude, MAX_LONGITUDE, LONGITUDE_NOT_A_NUMBER, LONGITUDE_OUT_OF_RANGE);
    }

    /**
     * Both absent is valid. Exactly one present always fails with {@link #COORDINATES_INCOMPLETE},
     * whatever the present value is. Both present returns the first individual failure, if any.
     */
    public static ValidationResult validateCoordinates(Object latitude, Object longitude) {
        if (latitude == null && longitude == null) {
            return ValidationResult.ok();
        }
        if (latitude == null || longitude == null) {
            return ValidationResult.fail(COORDINATES_INCOMPLETE);
        }
        ValidationResult latitudeResult = validateLatitude(latitude);
        if (!latitudeResult.valid()) {
            return latitudeResult;
        }
        return validateLongitude(longitude);
    }

    /**
     * Converts an untyped coordinate to a finite double, or null if it is not numeric. Booleans are
     * rejected even though some encoders treat them as 0/1.
     */
    public static Double toFiniteDouble(Object value) {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof CharSequence text) {
            try {
                parsed = Double.parseDouble(text.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    private static ValidationResult validateDegrees(
            Object value, double bound, String notANumber, String outOfRange) {
        if (value == null) {
            return ValidationResult.ok();
        }
        Double degrees = toFiniteDouble(value);
        if (degrees == null) {
            return ValidationResult.fail(notANumber);
        }
        if (degrees < -bound || degrees > bound) {
            return ValidationResult.fail(outOfRange);
        }
        return ValidationResult.ok();
    }

    private static Validator buildValidator() {
        ValidatorFactory factory =
                Validation.byDefaultProvider()
                        .configure()
                        .messageInterpolator(new ParameterMessageInterpolator())
                        .buildValidatorFactory();
        return factory.getValidator();
    }

    /** Constraint holder for {@link Validator#validateValue}. */
    private static final class EmailAddress {
        @Email private String value;
    }
}
