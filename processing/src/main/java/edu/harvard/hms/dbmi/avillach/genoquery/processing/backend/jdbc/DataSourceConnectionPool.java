package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.jdbc;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.ConnectionPool;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.QueryConnection;
import org.springframework.jdbc.support.SQLExceptionTranslator;
import org.springframework.jdbc.support.SQLStateSQLExceptionTranslator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Hands out at most {@code maxConnections} JDBC connections of a {@link DataSource} at a time.
 */
public class DataSourceConnectionPool implements ConnectionPool {

    private final DataSource dataSource;
    private final Semaphore permits;
    private final SQLExceptionTranslator exceptionTranslator = new SQLStateSQLExceptionTranslator();

    public DataSourceConnectionPool(DataSource dataSource, int maxConnections) {
        this.dataSource = dataSource;
        this.permits = new Semaphore(maxConnections, true);
    }

    @Override
    public QueryConnection acquire(long timeout, TimeUnit unit) throws InterruptedException {
        if (!permits.tryAcquire(timeout, unit)) {
            return null;
        }
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            permits.release();
            throw JdbcQueryConnection.translate(exceptionTranslator, "acquire connection", null, e);
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        return new JdbcQueryConnection(connection, exceptionTranslator, permits::release);
    }

    public int availableConnections() {
        return permits.availablePermits();
    }
}
