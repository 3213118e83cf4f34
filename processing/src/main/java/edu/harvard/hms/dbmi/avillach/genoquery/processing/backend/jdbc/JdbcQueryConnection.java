package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.jdbc;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.QueryConnection;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.RowCursor;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.CompiledQuery;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.ParameterizedSql;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.SQLExceptionTranslator;

import java.sql.*;
import java.util.List;

/**
 * Runs SQL text through a {@link Statement} and parameterized SQL through a {@link PreparedStatement}.
 */
public class JdbcQueryConnection implements QueryConnection {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryConnection.class);

    private final Connection connection;
    private final SQLExceptionTranslator exceptionTranslator;
    private final Runnable onClose;

    private volatile Statement statement;
    private boolean closed;

    JdbcQueryConnection(Connection connection, SQLExceptionTranslator exceptionTranslator, Runnable onClose) {
        this.connection = connection;
        this.exceptionTranslator = exceptionTranslator;
        this.onClose = onClose;
    }

    @Override
    public RowCursor execute(CompiledQuery query) {
        String sql = null;
        Statement created = null;
        ResultSet resultSet = null;
        try {
            if (query.getPayload() instanceof SqlText) {
                sql = ((SqlText) query.getPayload()).sql();
                created = connection.createStatement();
                statement = created;
                resultSet = created.executeQuery(sql);
                return new JdbcRowCursor(created, resultSet, exceptionTranslator);
            }
            if (query.getPayload() instanceof ParameterizedSql) {
                ParameterizedSql parameterized = (ParameterizedSql) query.getPayload();
                sql = parameterized.sql();
                PreparedStatement prepared = connection.prepareStatement(sql);
                created = prepared;
                statement = prepared;
                List<Object> parameters = parameterized.parameters();
                for (int i = 0; i < parameters.size(); i++) {
                    prepared.setObject(i + 1, parameters.get(i));
                }
                resultSet = prepared.executeQuery();
                return new JdbcRowCursor(prepared, resultSet, exceptionTranslator);
            }
        } catch (SQLException e) {
            release(created, resultSet);
            throw translate(exceptionTranslator, "execute " + query.getDialect() + " query", sql, e);
        } catch (RuntimeException e) {
            release(created, resultSet);
            throw e;
        }
        throw new IllegalArgumentException("JDBC backend cannot run " + query.getPayload().getClass().getSimpleName());
    }

    private void release(Statement created, ResultSet resultSet) {
        JdbcUtils.closeResultSet(resultSet);
        JdbcUtils.closeStatement(created);
        statement = null;
    }

    @Override
    public void cancel() {
        Statement inFlight = statement;
        if (inFlight == null) {
            return;
        }
        try {
            inFlight.cancel();
        } catch (SQLException e) {
            log.warn("Unable to cancel statement: " + e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Unable to close connection: " + e.getMessage());
        } finally {
            onClose.run();
        }
    }

    /**
     * Translators return null for SQL states they do not recognize.
     */
    static DataAccessException translate(SQLExceptionTranslator translator, String task, String sql, SQLException e) {
        DataAccessException translated = translator.translate(task, sql, e);
        return translated != null ? translated : new UncategorizedSQLException(task, sql, e);
    }
}
