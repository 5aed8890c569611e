package com.cityhive.service.infrastructure.persistence;

import static com.cityhive.service.infrastructure.persistence.DataAccessTranslator.translate;

import com.cityhive.service.domain.inspection.Inspection;
import com.cityhive.service.domain.inspection.InspectionRepository;
import java.sql.Date;
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
 * {@link InspectionRepository} on the {@code inspections} table.
 */
@Repository
public class JdbcInspectionRepository implements InspectionRepository {

    private static final String SELECT =
            "SELECT id, hive_id, scheduled_for, notes, created_at FROM inspections";

    private static final RowMapper<Inspection> ROW_MAPPER = JdbcInspectionRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcInspectionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Inspection> findById(long id) {
        return translate("Find inspection by id", () -> jdbc.query(
                        SELECT + " WHERE id = :id", new MapSqlParameterSource("id", id), ROW_MAPPER)
                .stream()
                .findFirst());
    }

    @Override
    public List<Inspection> findByHiveId(long hiveId) {
        return translate("Find inspections by hive", () -> jdbc.query(
                SELECT + " WHERE hive_id = :hiveId ORDER BY scheduled_for, id",
                new MapSqlParameterSource("hiveId", hiveId),
                ROW_MAPPER));
    }

    @Override
    public Inspection save(Inspection inspection) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("hiveId", inspection.hiveId())
                .addValue("scheduledFor", Date.valueOf(inspection.scheduledFor()))
                .addValue("notes", inspection.notes())
                .addValue("createdAt", Timestamp.from(inspection.createdAt()));
        Long id = translate("Insert inspection", () -> jdbc.queryForObject(
                "INSERT INTO inspections (hive_id, scheduled_for, notes, created_at) "
                        + "VALUES (:hiveId, :scheduledFor, :notes, :createdAt) RETURNING id",
                params,
                Long.class));
        return inspection.withId(id);
    }

    private static Inspection mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Inspection(
                rs.getLong("id"),
                rs.getLong("hive_id"),
                rs.getDate("scheduled_for").toLocalDate(),
                rs.getString("notes"),
                rs.getTimestamp("created_at").toInstant());
    }
}
