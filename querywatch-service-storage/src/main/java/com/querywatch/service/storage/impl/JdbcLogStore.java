package com.querywatch.service.storage.impl;

import com.querywatch.service.core.query.BuiltQuery;
import com.querywatch.service.core.spi.LogStore;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link LogStore} over ClickHouse via JDBC. Values are handed back as the driver produces them,
 * except SQL arrays, which are unwrapped to plain Java arrays.
 */
@Repository
@RequiredArgsConstructor
public class JdbcLogStore implements LogStore {

    private final JdbcTemplate jdbc;

    @Override
    public List<Object[]> fetch(BuiltQuery query) {
        return jdbc.query(query.sql(), (rs, rowNum) -> readRow(rs), query.argArray());
    }

    @Override
    public void ping() {
        jdbc.queryForObject("SELECT 1", Integer.class);
    }

    static Object[] readRow(ResultSet rs) throws SQLException {
        int width = rs.getMetaData().getColumnCount();
        Object[] row = new Object[width];
        for (int i = 0; i < width; i++) {
            Object value = rs.getObject(i + 1);
            if (value instanceof Array array) {
                try {
                    value = array.getArray();
                } finally {
                    array.free();
                }
            }
            row[i] = value;
        }
        return row;
    }
}
