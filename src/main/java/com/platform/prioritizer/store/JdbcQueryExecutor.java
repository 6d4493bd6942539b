package com.platform.prioritizer.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryExecutor} over Spring JDBC. {@link LocalDateTime} parameters are bound as
 * SQL timestamps so the database compares them without a session time zone.
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcQueryExecutor(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Map<String, Object> params) {
        MapSqlParameterSource source = new MapSqlParameterSource();
        params.forEach((name, value) -> {
            if (value instanceof LocalDateTime ldt) {
                source.addValue(name, Timestamp.valueOf(ldt), Types.TIMESTAMP);
            } else {
                source.addValue(name, value);
            }
        });
        long t0 = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, source);
            log.debug("Query returned {} rows in {} ms (params {})", rows.size(), System.currentTimeMillis() - t0, params);
            return rows;
        } catch (DataAccessException e) {
            log.error("Query failed with params {}: {}", params, sql, e);
            throw e;
        }
    }
}
