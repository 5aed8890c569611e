package com.cityhive.observability;

/**
 * Health status for an individual component or the aggregate system.
 */
public enum HealthStatus {

    /** The component answered within its deadline without error. */
    HEALTHY,

    /** The component failed, timed out, or the check was cancelled. */
    UNHEALTHY
}
