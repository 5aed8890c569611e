package com.cityhive.database.health;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcRoundTripCheck")
class JdbcRoundTripCheckTest {

    @Test
    @DisplayName("succeeds against a reachable database")
    void succeedsAgainstH2() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:roundtrip");

        assertThatCode(() -> new JdbcRoundTripCheck(dataSource).execute()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("propagates connection failures")
    void propagatesConnectionFailure() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLTransientConnectionException("pool exhausted"));

        assertThatThrownBy(() -> new JdbcRoundTripCheck(dataSource).execute())
                .isInstanceOf(SQLTransientConnectionException.class);
    }

    @Test
    @DisplayName("closes the connection after a failed query")
    void closesConnectionOnQueryFailure() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute(JdbcRoundTripCheck.QUERY)).thenThrow(new SQLException("terminated"));

        assertThatThrownBy(() -> new JdbcRoundTripCheck(dataSource).execute())
                .isInstanceOf(SQLException.class)
                .hasMessage("terminated");
        verify(statement).close();
        verify(connection).close();
    }

    @Test
    @DisplayName("rejects a missing data source")
    void rejectsNullDataSource() {
        assertThatThrownBy(() -> new JdbcRoundTripCheck(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
