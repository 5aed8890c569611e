package com.cityhive.service.domain.creation;

/**
 * Closed set of reasons a creation request can fail.
 */
public enum CreationErrorKind {

    /** A referenced parent entity does not exist. */
    NOT_FOUND,

    /** The input failed a semantic check. */
    INVALID_INPUT,

    /** The store rejected the write because of a uniqueness or integrity constraint. */
    CONFLICT,

    /** The store failed for a reason other than a constraint violation. */
    DEPENDENCY_FAILURE,

    /** Anything not anticipated by the other kinds. */
    UNKNOWN
}
