package edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.jdbc;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.backend.RowCursor;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.SQLExceptionTranslator;

import java.sql.*;
import java.util.*;

class JdbcRowCursor implements RowCursor {

    private final Statement statement;
    private final ResultSet resultSet;
    private final SQLExceptionTranslator exceptionTranslator;
    private final String[] labels;

    JdbcRowCursor(Statement statement, ResultSet resultSet, SQLExceptionTranslator exceptionTranslator) throws SQLException {
        this.statement = statement;
        this.resultSet = resultSet;
        this.exceptionTranslator = exceptionTranslator;
        ResultSetMetaData metaData = resultSet.getMetaData();
        labels = new String[metaData.getColumnCount()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = metaData.getColumnLabel(i + 1).toLowerCase(Locale.ROOT);
        }
    }

    @Override
    public Map<String, Object> fetchNext() {
        try {
            if (!resultSet.next()) {
                return null;
            }
            Map<String, Object> row = new HashMap<>();
            for (int i = 0; i < labels.length; i++) {
                row.put(labels[i], readValue(resultSet.getObject(i + 1)));
            }
            return row;
        } catch (SQLException e) {
            throw JdbcQueryConnection.translate(exceptionTranslator, "fetch row", null, e);
        }
    }

    private static Object readValue(Object value) throws SQLException {
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Array) {
            return Arrays.asList((Object[]) ((Array) value).getArray());
        }
        return value;
    }

    @Override
    public void close() {
        JdbcUtils.closeResultSet(resultSet);
        JdbcUtils.closeStatement(statement);
    }
}
