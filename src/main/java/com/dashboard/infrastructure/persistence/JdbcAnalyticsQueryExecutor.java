package com.dashboard.infrastructure.persistence;

import com.dashboard.domain.catalog.QueryDefinition;
import com.dashboard.domain.exception.AnalyticsQueryTimeoutException;
import com.dashboard.domain.exception.QueryExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JDBC executor for catalog queries.
 * 
 * Each call runs in its own read-only transaction with two timeouts:
 * - PostgreSQL statement_timeout, set transaction-locally via set_config
 * - the Spring transaction timeout, applied to every JDBC statement
 * 
 * The pooled connection is bound to the transaction and returned on every
 * exit path, including timeouts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcAnalyticsQueryExecutor implements AnalyticsQueryExecutor {

    static final String SET_STATEMENT_TIMEOUT = "SELECT set_config('statement_timeout', :timeout, true)";

    // PostgreSQL query_canceled
    private static final String QUERY_CANCELED_STATE = "57014";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;

    @Override
    public List<Map<String, Object>> execute(QueryDefinition definition, Map<String, Object> params) {
        Duration timeout = definition.getTimeout();
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        transaction.setReadOnly(true);
        transaction.setTimeout(timeoutSeconds(timeout));

        long startTime = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = transaction.execute(status -> {
                jdbcTemplate.queryForObject(SET_STATEMENT_TIMEOUT,
                        Map.of("timeout", timeout.toMillis() + "ms"), String.class);
                return jdbcTemplate.queryForList(definition.getSql(), new MapSqlParameterSource(params));
            });

            List<Map<String, Object>> normalized = RowNormalizer.normalize(rows == null ? Collections.emptyList() : rows);
            log.info("Query {} returned {} rows in {} ms",
                    definition.getName(), normalized.size(), System.currentTimeMillis() - startTime);
            return normalized;

        } catch (DataAccessException | TransactionException e) {
            if (isTimeout(e)) {
                log.warn("Query {} timed out after {} ms", definition.getName(), System.currentTimeMillis() - startTime);
                throw new AnalyticsQueryTimeoutException(definition.getName(), timeout, e);
            }
            log.error("Query {} failed: {}", definition.getName(), e.getMessage());
            throw new QueryExecutionException("Query " + definition.getName() + " failed", e);
        }
    }

    private static int timeoutSeconds(Duration timeout) {
        long seconds = timeout.toSeconds();
        if (timeout.toNanosPart() > 0 || seconds == 0) {
            seconds++;
        }
        return (int) Math.min(Integer.MAX_VALUE, seconds);
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof QueryTimeoutException || t instanceof TransactionTimedOutException
                    || t instanceof SQLTimeoutException) {
                return true;
            }
            if (t instanceof SQLException && QUERY_CANCELED_STATE.equals(((SQLException) t).getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
