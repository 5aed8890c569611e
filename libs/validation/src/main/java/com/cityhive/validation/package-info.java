/**
 * Field validation for incoming records.
 *
 * <p>Every check is a pure function returning a {@link com.cityhive.validation.ValidationResult}.
 * Nothing here performs I/O or throws for bad input, so the checks can run anywhere in the
 * request path, including before the database is consulted.
 */
package com.cityhive.validation;
