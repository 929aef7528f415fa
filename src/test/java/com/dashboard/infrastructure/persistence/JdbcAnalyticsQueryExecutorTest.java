package com.dashboard.infrastructure.persistence;

import com.dashboard.domain.catalog.AnalyticsOperation;
import com.dashboard.domain.catalog.CachePolicy;
import com.dashboard.domain.catalog.QueryDefinition;
import com.dashboard.domain.exception.AnalyticsQueryTimeoutException;
import com.dashboard.domain.exception.QueryExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcAnalyticsQueryExecutorTest {

    private static final String SQL = "SELECT hour, event_count FROM mv_hourly_metrics WHERE hour >= NOW() - (INTERVAL '1 hour' * :hours)";

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JdbcAnalyticsQueryExecutor executor;
    private QueryDefinition definition;

    @BeforeEach
    void setUp() {
        executor = new JdbcAnalyticsQueryExecutor(jdbcTemplate, transactionManager);
        definition = QueryDefinition.builder()
                .operation(AnalyticsOperation.DASHBOARD_METRICS)
                .sql(SQL)
                .parameterNames(Set.of("hours"))
                .cachePolicy(CachePolicy.cachedUntilRefresh(Duration.ofMinutes(5)))
                .timeout(Duration.ofMillis(2500))
                .build();
        when(transactionManager.getTransaction(any(TransactionDefinition.class))).thenReturn(new SimpleTransactionStatus());
    }

    @Test
    void testExecute_ReadOnlyTransactionWithTimeouts() {
        // Given
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("hour", Timestamp.from(Instant.parse("2024-03-01T12:00:00Z")));
        row.put("event_count", 42);
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class))).thenReturn(List.of(row));

        // When
        List<Map<String, Object>> rows = executor.execute(definition, Map.of("hours", 24));

        // Then
        assertEquals(1, rows.size());
        assertEquals("2024-03-01T12:00:00Z", rows.get(0).get("hour"));
        assertEquals(42L, rows.get(0).get("event_count"));

        ArgumentCaptor<TransactionDefinition> transaction = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(transaction.capture());
        assertTrue(transaction.getValue().isReadOnly());
        assertEquals(3, transaction.getValue().getTimeout());

        verify(jdbcTemplate).queryForObject(JdbcAnalyticsQueryExecutor.SET_STATEMENT_TIMEOUT,
                Map.of("timeout", "2500ms"), String.class);
        verify(transactionManager).commit(any());
    }

    @Test
    void testExecute_ParametersBoundByName() {
        // Given
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class))).thenReturn(List.of());

        // When
        executor.execute(definition, Map.of("hours", 24));

        // Then
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).queryForList(eq(SQL), params.capture());
        assertEquals(24, params.getValue().getValue("hours"));
    }

    @Test
    void testExecute_StatementTimeoutTranslated() {
        // Given
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class)))
                .thenThrow(new QueryTimeoutException("canceling statement due to statement timeout"));

        // When
        AnalyticsQueryTimeoutException e = assertThrows(AnalyticsQueryTimeoutException.class,
                () -> executor.execute(definition, Map.of("hours", 24)));

        // Then
        assertEquals("dashboard_metrics", e.getOperationName());
        assertEquals(Duration.ofMillis(2500), e.getTimeout());
        verify(transactionManager).rollback(any());
    }

    @Test
    void testExecute_QueryCanceledStateTreatedAsTimeout() {
        // Given
        SQLException canceled = new SQLException("canceling statement due to statement timeout", "57014");
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class)))
                .thenThrow(new UncategorizedSQLException("query", SQL, canceled));

        // When / Then
        assertThrows(AnalyticsQueryTimeoutException.class, () -> executor.execute(definition, Map.of("hours", 24)));
    }

    @Test
    void testExecute_TransactionDeadlineTreatedAsTimeout() {
        // Given
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class)))
                .thenThrow(new TransactionTimedOutException("Transaction timed out: deadline was reached"));

        // When / Then
        assertThrows(AnalyticsQueryTimeoutException.class, () -> executor.execute(definition, Map.of("hours", 24)));
    }

    @Test
    void testExecute_OtherFailuresReportedAsExecutionError() {
        // Given
        SQLException missing = new SQLException("relation \"mv_hourly_metrics\" does not exist", "42P01");
        when(jdbcTemplate.queryForList(eq(SQL), any(SqlParameterSource.class)))
                .thenThrow(new BadSqlGrammarException("query", SQL, missing));

        // When
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> executor.execute(definition, Map.of("hours", 24)));

        // Then
        assertInstanceOf(BadSqlGrammarException.class, e.getCause());
        verify(transactionManager).rollback(any());
    }
}
