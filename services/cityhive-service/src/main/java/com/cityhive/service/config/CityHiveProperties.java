package com.cityhive.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration properties for the CityHive service.
 *
 * <p>Spring Boot binds YAML/env properties to this record at startup and validates them via Bean
 * Validation, so a misconfigured instance fails to start.
 *
 * <pre>
 * cityhive:
 *   service:
 *     name: cityhive
 *     environment: production
 *     version: 1.0.0
 *     description: Urban beekeeping records
 *     health:
 *       db-timeout: 5s
 *     inspection:
 *       max-days-ahead: 365
 * </pre>
 *
 * @param name        service name used in health results, logs and metric tags. Required.
 * @param environment deployment environment (development, staging, production)
 * @param version     service version reported by health endpoints
 * @param description human-readable service description
 * @param health      dependency probing settings
 * @param inspection  inspection scheduling policy
 */
@ConfigurationProperties(prefix = "cityhive.service")
@Validated
public record CityHiveProperties(
        @NotBlank String name,
        String environment,
        String version,
        String description,
        @Valid Health health,
        @Valid Inspection inspection) {

    public CityHiveProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (version == null || version.isBlank()) {
            version = "0.1.0";
        }
        if (health == null) {
            health = new Health(null);
        }
        if (inspection == null) {
            inspection = new Inspection(null);
        }
    }

    /**
     * @param dbTimeout deadline for the database round trip (default 5 s)
     */
    public record Health(Duration dbTimeout) {

        public Health {
            if (dbTimeout == null || dbTimeout.isZero() || dbTimeout.isNegative()) {
                dbTimeout = Duration.ofSeconds(5);
            }
        }
    }

    /**
     * @param maxDaysAhead how far ahead an inspection may be scheduled (default 365)
     */
    public record Inspection(Integer maxDaysAhead) {

        public Inspection {
            if (maxDaysAhead == null || maxDaysAhead < 0) {
                maxDaysAhead = 365;
            }
        }
    }
}
