package com.cityhive.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Runs the configured Flyway instance against an in-memory H2 database with a test-only
 * migration location. The production migrations need PostGIS and are exercised by the service
 * module's container tests.
 */
@DisplayName("FlywayMigrationConfig")
class FlywayMigrationConfigTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:flyway-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
    }

    @Test
    @DisplayName("migrates the configured locations")
    void migratesConfiguredLocations() throws SQLException {
        var props = new FlywayConfigProperties(true, "classpath:db/testmigration", false);
        Flyway flyway = new FlywayMigrationConfig().cityhiveFlyway(dataSource, props);

        flyway.migrate();

        assertThat(flyway.info().current().getVersion().getVersion()).isEqualTo("1");
        try (Connection connection = dataSource.getConnection();
                ResultSet tables = connection.getMetaData().getTables(null, null, "PROBE_MARKER", null)) {
            assertThat(tables.next()).isTrue();
        }
    }

    @Test
    @DisplayName("disables clean")
    void disablesClean() {
        var props = new FlywayConfigProperties(true, "classpath:db/testmigration", false);
        Flyway flyway = FlywayMigrationConfig.createFlyway(dataSource, props);

        assertThat(flyway.getConfiguration().isCleanDisabled()).isTrue();
    }

    @Test
    @DisplayName("accepts comma separated locations")
    void splitsLocations() {
        var props = new FlywayConfigProperties(true, "classpath:db/testmigration, classpath:db/extra", true);
        Flyway flyway = FlywayMigrationConfig.createFlyway(dataSource, props);

        assertThat(flyway.getConfiguration().getLocations()).hasSize(2);
        assertThat(flyway.getConfiguration().isBaselineOnMigrate()).isTrue();
    }
}
