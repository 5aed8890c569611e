package com.cityhive.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the SQL migration files are packaged on the classpath and define the expected
 * schema objects.
 */
@DisplayName("Migration SQL Resource Verification")
class MigrationResourceTest {

    @Test
    @DisplayName("V1__create_users.sql defines unique email and api key")
    void usersMigration() throws IOException {
        String sql = readClasspathResource("db/migration/V1__create_users.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE users");
        assertThat(sql).contains("VARCHAR(100)").contains("VARCHAR(254)");
        assertThat(sql).containsIgnoringCase("CREATE UNIQUE INDEX ix_users_email");
        assertThat(sql).containsIgnoringCase("CREATE UNIQUE INDEX ix_users_api_key");
    }

    @Test
    @DisplayName("V2__create_hives.sql stores location as a WGS84 geography point")
    void hivesMigration() throws IOException {
        String sql = readClasspathResource("db/migration/V2__create_hives.sql");

        assertThat(sql).containsIgnoringCase("CREATE EXTENSION IF NOT EXISTS postgis");
        assertThat(sql).contains("geography(POINT, 4326)");
        assertThat(sql).containsIgnoringCase("REFERENCES users (id) ON DELETE CASCADE");
    }

    @Test
    @DisplayName("V3__create_inspections.sql cascades from hives")
    void inspectionsMigration() throws IOException {
        String sql = readClasspathResource("db/migration/V3__create_inspections.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE inspections");
        assertThat(sql).containsIgnoringCase("scheduled_for DATE");
        assertThat(sql).containsIgnoringCase("REFERENCES hives (id) ON DELETE CASCADE");
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
