package com.cityhive.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for CityHive services.
 *
 * <p>Builds a single Flyway instance on the application {@link DataSource} and migrates when the
 * bean is initialised, so the schema is current before any repository is used. Clean is always
 * disabled.
 *
 * <p>Services using this module should exclude {@link FlywayAutoConfiguration}:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = FlywayAutoConfiguration.class)
 * }</pre>
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "cityhive.flyway", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name for the application database Flyway instance. */
    public static final String FLYWAY_BEAN = "cityhiveFlyway";

    @Bean(name = FLYWAY_BEAN, initMethod = "migrate")
    public Flyway cityhiveFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        log.info("Configuring Flyway: locations={}, baselineOnMigrate={}",
                properties.locations(), properties.baselineOnMigrate());
        return createFlyway(dataSource, properties);
    }

    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().split("\\s*,\\s*"))
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
