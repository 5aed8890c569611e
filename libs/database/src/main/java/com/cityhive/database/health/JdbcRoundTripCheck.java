package com.cityhive.database.health;

import com.cityhive.observability.DependencyCheck;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;

/**
 * Database round trip for readiness probing.
 *
 * <p>Borrows a connection and runs {@code SELECT 1}. Does not touch any table and never writes.
 * Any {@link SQLException} propagates to the probe, which reports the dependency as unhealthy.
 */
public final class JdbcRoundTripCheck implements DependencyCheck {

    static final String QUERY = "SELECT 1";

    private final DataSource dataSource;

    public JdbcRoundTripCheck(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.dataSource = dataSource;
    }

    @Override
    public void execute() throws SQLException {
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            statement.execute(QUERY);
        }
    }
}
