package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.jdbc;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.StubConnectionPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.support.SQLStateSQLExceptionTranslator;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcQueryConnectionTest {

    @Mock
    private Connection connection;
    @Mock
    private Statement statement;
    @Mock
    private ResultSet resultSet;
    @Mock
    private ResultSetMetaData metaData;

    private final SQLStateSQLExceptionTranslator translator = new SQLStateSQLExceptionTranslator();

    @Test
    public void execute_queryFails_statementClosedAndNotCancelledLater() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("SELECT 1")).thenThrow(new SQLException("syntax error", "42000"));
        JdbcQueryConnection queryConnection = new JdbcQueryConnection(connection, translator, () -> { });

        assertThrows(DataAccessException.class, () -> queryConnection.execute(StubConnectionPool.query()));
        queryConnection.cancel();

        verify(statement).close();
        verify(statement, never()).cancel();
    }

    @Test
    public void execute_metadataFails_resultSetAndStatementClosed() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("SELECT 1")).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenThrow(new SQLException("connection reset", "08006"));
        JdbcQueryConnection queryConnection = new JdbcQueryConnection(connection, translator, () -> { });

        assertThrows(DataAccessException.class, () -> queryConnection.execute(StubConnectionPool.query()));

        verify(resultSet).close();
        verify(statement).close();
    }

    @Test
    public void cursorClose_resultSetCloseFails_statementStillClosed() throws SQLException {
        when(resultSet.getMetaData()).thenReturn(metaData);
        doThrow(new SQLException("already closed")).when(resultSet).close();
        JdbcRowCursor cursor = new JdbcRowCursor(statement, resultSet, translator);

        cursor.close();

        verify(statement).close();
    }
}
