package com.cityhive.service.infrastructure.persistence;

import static com.cityhive.service.infrastructure.persistence.DataAccessTranslator.translate;

import com.cityhive.service.domain.user.User;
import com.cityhive.service.domain.user.UserRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link UserRepository} on the {@code users} table.
 */
@Repository
public class JdbcUserRepository implements UserRepository {

    private static final String COLUMNS = "id, name, email, api_key, registered_at";

    private static final RowMapper<User> ROW_MAPPER = JdbcUserRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcUserRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<User> findById(long id) {
        return translate("Find user by id", () -> jdbc.query(
                        "SELECT " + COLUMNS + " FROM users WHERE id = :id",
                        new MapSqlParameterSource("id", id),
                        ROW_MAPPER)
                .stream()
                .findFirst());
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return translate("Find user by email", () -> jdbc.query(
                        "SELECT " + COLUMNS + " FROM users WHERE email = :email",
                        new MapSqlParameterSource("email", email),
                        ROW_MAPPER)
                .stream()
                .findFirst());
    }

    @Override
    public boolean existsByEmail(String email) {
        return translate("Check user email", () -> Boolean.TRUE.equals(jdbc.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM users WHERE email = :email)",
                new MapSqlParameterSource("email", email),
                Boolean.class)));
    }

    @Override
    public User save(User user) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", user.name())
                .addValue("email", user.email())
                .addValue("apiKey", user.apiKey())
                .addValue("registeredAt", Timestamp.from(user.registeredAt()));
        Long id = translate("Insert user", () -> jdbc.queryForObject(
                "INSERT INTO users (name, email, api_key, registered_at) "
                        + "VALUES (:name, :email, :apiKey, :registeredAt) RETURNING id",
                params,
                Long.class));
        return user.withId(id);
    }

    private static User mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new User(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("email"),
                rs.getObject("api_key", UUID.class),
                rs.getTimestamp("registered_at").toInstant());
    }
}
