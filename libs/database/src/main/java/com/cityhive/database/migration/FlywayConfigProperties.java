package com.cityhive.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the application database.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * cityhive:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration
 *     baseline-on-migrate: false
 * }</pre>
 *
 * @param enabled           whether to migrate on startup
 * @param locations         Flyway migration locations
 * @param baselineOnMigrate whether to baseline a non-empty schema that has no history table
 */
@Validated
@ConfigurationProperties(prefix = "cityhive.flyway")
public record FlywayConfigProperties(
        boolean enabled,
        @NotBlank String locations,
        boolean baselineOnMigrate) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration";

    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
