package com.cityhive.service;

import com.cityhive.database.migration.FlywayMigrationConfig;
import com.cityhive.service.config.CityHiveProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * CityHive service: users, hives and inspections over HTTP, backed by PostgreSQL with PostGIS.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Liveness and readiness endpoints under {@code /health}
 *   <li>Actuator metrics and Prometheus endpoints
 *   <li>Correlation ID propagation on every HTTP request
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Schema migration on startup through {@link FlywayMigrationConfig}
 * </ul>
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@EnableConfigurationProperties(CityHiveProperties.class)
@Import(FlywayMigrationConfig.class)
public class CityHiveServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(CityHiveServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CityHiveServiceApplication.class, args);
        log.info("CityHive service started successfully");
    }
}
