package com.cityhive.service.domain.creation;

/**
 * Entities that can be created through the API, each with its own mapping from
 * {@link CreationErrorKind} to HTTP status.
 */
public enum EntityType {

    USER("user") {
        @Override
        public int httpStatus(CreationErrorKind kind) {
            return switch (kind) {
                case CONFLICT -> 409;
                case DEPENDENCY_FAILURE, UNKNOWN -> 500;
                default -> 400;
            };
        }
    },

    HIVE("hive") {
        @Override
        public int httpStatus(CreationErrorKind kind) {
            return switch (kind) {
                case NOT_FOUND -> 404;
                case CONFLICT -> 409;
                case DEPENDENCY_FAILURE, UNKNOWN -> 500;
                default -> 400;
            };
        }
    },

    // Store failures report 400 here, matching the published contract of the inspections endpoint.
    INSPECTION("inspection") {
        @Override
        public int httpStatus(CreationErrorKind kind) {
            return switch (kind) {
                case NOT_FOUND -> 404;
                case CONFLICT -> 409;
                default -> 400;
            };
        }
    };

    private final String tag;

    EntityType(String tag) {
        this.tag = tag;
    }

    /** HTTP status for a failed creation of this entity. Never 2xx. */
    public abstract int httpStatus(CreationErrorKind kind);

    /** Lower-case name used in metric tags and log lines. */
    public String tag() {
        return tag;
    }
}
