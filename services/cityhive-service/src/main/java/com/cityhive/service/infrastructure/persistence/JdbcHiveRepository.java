package com.cityhive.service.infrastructure.persistence;

import static com.cityhive.service.infrastructure.persistence.DataAccessTranslator.translate;

import com.cityhive.service.domain.hive.GeoPoint;
import com.cityhive.service.domain.hive.Hive;
import com.cityhive.service.domain.hive.HiveRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link HiveRepository} on the {@code hives} table. Locations are stored as PostGIS
 * {@code geography(POINT, 4326)}; note that PostGIS points take longitude first.
 */
@Repository
public class JdbcHiveRepository implements HiveRepository {

    private static final String SELECT = "SELECT id, user_id, name, frame_type, installed_at, "
            + "ST_Y(location::geometry) AS latitude, ST_X(location::geometry) AS longitude FROM hives";

    private static final String INSERT_WITH_LOCATION =
            "INSERT INTO hives (user_id, name, location, frame_type, installed_at) VALUES "
                    + "(:userId, :name, ST_SetSRID(ST_MakePoint(:longitude, :latitude), " + GeoPoint.SRID
                    + ")::geography, :frameType, :installedAt) RETURNING id";

    private static final String INSERT_WITHOUT_LOCATION =
            "INSERT INTO hives (user_id, name, frame_type, installed_at) VALUES "
                    + "(:userId, :name, :frameType, :installedAt) RETURNING id";

    private static final RowMapper<Hive> ROW_MAPPER = JdbcHiveRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcHiveRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Hive> findById(long id) {
        return translate("Find hive by id", () -> jdbc.query(
                        SELECT + " WHERE id = :id", new MapSqlParameterSource("id", id), ROW_MAPPER)
                .stream()
                .findFirst());
    }

    @Override
    public List<Hive> findByUserId(long userId) {
        return translate("Find hives by user", () -> jdbc.query(
                SELECT + " WHERE user_id = :userId ORDER BY installed_at DESC, id DESC",
                new MapSqlParameterSource("userId", userId),
                ROW_MAPPER));
    }

    @Override
    public Hive save(Hive hive) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", hive.userId())
                .addValue("name", hive.name())
                .addValue("frameType", hive.frameType())
                .addValue("installedAt", Timestamp.from(hive.installedAt()));
        String sql = INSERT_WITHOUT_LOCATION;
        if (hive.location() != null) {
            params.addValue("latitude", hive.location().latitude())
                    .addValue("longitude", hive.location().longitude());
            sql = INSERT_WITH_LOCATION;
        }
        String insert = sql;
        Long id = translate("Insert hive", () -> jdbc.queryForObject(insert, params, Long.class));
        return hive.withId(id);
    }

    private static Hive mapRow(ResultSet rs, int rowNum) throws SQLException {
        double latitude = rs.getDouble("latitude");
        GeoPoint location = rs.wasNull() ? null : new GeoPoint(latitude, rs.getDouble("longitude"));
        return new Hive(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getString("name"),
                location,
                rs.getString("frame_type"),
                rs.getTimestamp("installed_at").toInstant());
    }
}
