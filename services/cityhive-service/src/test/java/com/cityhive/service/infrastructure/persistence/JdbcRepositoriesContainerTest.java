package com.cityhive.service.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

import com.cityhive.service.domain.creation.IntegrityViolationException;
import com.cityhive.service.domain.hive.GeoPoint;
import com.cityhive.service.domain.hive.Hive;
import com.cityhive.service.domain.inspection.Inspection;
import com.cityhive.service.domain.user.User;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the JDBC repositories against PostGIS with the real migrations applied. Skipped when
 * Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("JDBC repositories on PostGIS")
class JdbcRepositoriesContainerTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGIS = new PostgreSQLContainer<>(
            DockerImageName.parse("postgis/postgis:16-3.4").asCompatibleSubstituteFor("postgres"));

    private static NamedParameterJdbcTemplate jdbc;

    private JdbcUserRepository users;
    private JdbcHiveRepository hives;
    private JdbcInspectionRepository inspections;

    @BeforeAll
    static void migrate() {
        var dataSource = new DriverManagerDataSource(
                POSTGIS.getJdbcUrl(), POSTGIS.getUsername(), POSTGIS.getPassword());
        Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .load()
                .migrate();
        jdbc = new NamedParameterJdbcTemplate(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbc.getJdbcTemplate().execute("TRUNCATE users RESTART IDENTITY CASCADE");
        users = new JdbcUserRepository(jdbc);
        hives = new JdbcHiveRepository(jdbc);
        inspections = new JdbcInspectionRepository(jdbc);
    }

    private User newUser(String email) {
        return users.save(new User(null, "Ada", email, UUID.randomUUID(), now()));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    @Test
    @DisplayName("stores and finds users, rejecting duplicate addresses")
    void users() {
        User saved = newUser("ada@example.com");

        assertThat(saved.id()).isPositive();
        assertThat(users.findById(saved.id())).contains(saved);
        assertThat(users.findByEmail("ada@example.com")).contains(saved);
        assertThat(users.existsByEmail("ada@example.com")).isTrue();
        assertThat(users.existsByEmail("bob@example.com")).isFalse();
        assertThatThrownBy(() -> newUser("ada@example.com"))
                .isInstanceOf(IntegrityViolationException.class);
    }

    @Test
    @DisplayName("round-trips hive locations through geography points")
    void hives() {
        long owner = newUser("owner@example.com").id();
        Hive located = hives.save(new Hive(
                null, owner, "Rooftop", new GeoPoint(40.7128, -74.006), "Langstroth", now()));
        Hive unlocated = hives.save(new Hive(null, owner, "Garden", null, null, now().plusSeconds(60)));

        Hive found = hives.findById(located.id()).orElseThrow();
        assertThat(found.location().latitude()).isCloseTo(40.7128, offset(1e-9));
        assertThat(found.location().longitude()).isCloseTo(-74.006, offset(1e-9));
        assertThat(hives.findById(unlocated.id()).orElseThrow().location()).isNull();
        assertThat(hives.findByUserId(owner)).extracting(Hive::id).containsExactly(unlocated.id(), located.id());
    }

    @Test
    @DisplayName("rejects a hive for a missing user")
    void hiveForeignKey() {
        assertThatThrownBy(() -> hives.save(new Hive(null, 9999L, "Orphan", null, null, now())))
                .isInstanceOf(IntegrityViolationException.class);
    }

    @Test
    @DisplayName("stores inspections and lists them by date")
    void inspections() {
        long owner = newUser("keeper@example.com").id();
        long hive = hives.save(new Hive(null, owner, "Rooftop", null, null, now())).id();
        LocalDate today = LocalDate.now();
        Inspection later = inspections.save(new Inspection(null, hive, today.plusDays(20), null, now()));
        Inspection sooner = inspections.save(new Inspection(null, hive, today.plusDays(2), "Queen check", now()));

        assertThat(inspections.findById(sooner.id())).contains(sooner);
        assertThat(inspections.findByHiveId(hive)).containsExactly(sooner, later);
    }
}
