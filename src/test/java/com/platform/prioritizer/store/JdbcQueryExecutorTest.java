package com.platform.prioritizer.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcQueryExecutorTest {

    private static final String SQL = "select entity_id, outcome from labels where date >= :as_of_date";

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcQueryExecutor executor;

    @Test
    void testBindsLocalDateTimeAsTimestamp() {
        List<Map<String, Object>> rows = List.of(Map.of("entity_id", 1, "outcome", 1));
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class))).thenReturn(rows);

        LocalDateTime asOf = LocalDateTime.of(2015, 1, 2, 0, 0);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("as_of_date", asOf);
        params.put("label_timespan", "1 month");

        assertEquals(rows, executor.query(SQL, params));

        ArgumentCaptor<SqlParameterSource> captor = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).queryForList(eq(SQL), captor.capture());
        MapSqlParameterSource source = (MapSqlParameterSource) captor.getValue();
        assertEquals(Timestamp.valueOf(asOf), source.getValue("as_of_date"));
        assertEquals(Types.TIMESTAMP, source.getSqlType("as_of_date"));
        assertEquals("1 month", source.getValue("label_timespan"));
    }

    @Test
    void testPropagatesDataAccessErrors() {
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class)))
                .thenThrow(new DataRetrievalFailureException("relation \"labels\" does not exist"));

        assertThrows(DataRetrievalFailureException.class, () -> executor.query(SQL, Map.of()));
    }
}
