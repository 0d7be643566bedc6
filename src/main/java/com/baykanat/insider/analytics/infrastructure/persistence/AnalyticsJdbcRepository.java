package com.baykanat.insider.analytics.infrastructure.persistence;

import com.baykanat.insider.analytics.domain.exception.QueryExecutionException;
import com.baykanat.insider.analytics.domain.exception.StoreUnavailableException;
import com.baykanat.insider.analytics.domain.model.AnalyticsStatement;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derlenmiş analitik SQL'i bağlı değerleriyle ClickHouse üzerinde çalıştırır ve satırları normalize eder.
 *
 * <p>Yeniden deneme yoktur; hata QueryExecutionException olarak yukarı çıkar. Circuit Breaker
 * açıkken sorgu gönderilmez, 503 döner.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class AnalyticsJdbcRepository {

    static final String CIRCUIT_BREAKER = "clickhouse";
    private static final int RETRY_AFTER_SECONDS = 30;

    private final JdbcTemplate jdbcTemplate;
    private final ResultNormalizer resultNormalizer;

    /** Satırları sütun sırası korunarak döner. */
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "handleCircuitBreakerOpen")
    public List<Map<String, Object>> query(AnalyticsStatement statement) {
        return execute(statement);
    }

    /** Tek satır, tek sayısal sütun döndüren sayım sorguları; satır yoksa 0. */
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "handleCountCircuitBreakerOpen")
    public long queryForCount(AnalyticsStatement statement, String column) {
        List<Map<String, Object>> rows = execute(statement);
        if (rows.isEmpty()) {
            return 0L;
        }
        Object value = rows.get(0).get(column);
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new QueryExecutionException(statement.getName(),
                new IllegalStateException("Count column " + column + " is missing or not numeric"));
    }

    private List<Map<String, Object>> execute(AnalyticsStatement statement) {
        String sql = Objects.requireNonNull(statement.getSql(), "sql");
        long start = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, statement.getArgs().toArray());
            log.info("Query {} returned {} rows in {}ms",
                    statement.getName(), rows.size(), System.currentTimeMillis() - start);
            return resultNormalizer.normalize(rows);
        } catch (DataAccessException e) {
            log.error("Query {} failed after {}ms: {}\n{}\nargs={}",
                    statement.getName(), System.currentTimeMillis() - start, e.getMessage(), sql, statement.getArgs(), e);
            throw new QueryExecutionException(statement.getName(), e);
        }
    }

    /** Circuit breaker açıkken 503 + Retry-After. */
    @SuppressWarnings("unused")
    private List<Map<String, Object>> handleCircuitBreakerOpen(AnalyticsStatement statement,
                                                               CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for ClickHouse. Rejecting query {}", statement.getName());
        throw new StoreUnavailableException(
                "Analytics store is temporarily unavailable. ClickHouse circuit breaker is open.", RETRY_AFTER_SECONDS);
    }

    @SuppressWarnings("unused")
    private long handleCountCircuitBreakerOpen(AnalyticsStatement statement, String column,
                                               CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for ClickHouse. Rejecting count query {}", statement.getName());
        throw new StoreUnavailableException(
                "Analytics store is temporarily unavailable. ClickHouse circuit breaker is open.", RETRY_AFTER_SECONDS);
    }
}
