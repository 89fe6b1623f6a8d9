package com.restaurant.analytics.infrastructure.persistence;

import com.restaurant.analytics.domain.exception.QueryExecutionException;
import com.restaurant.analytics.domain.query.RenderedQuery;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs rendered analytics queries as native SQL with bound parameters.
 *
 * Storage-side policies:
 * - Read-only transaction and statement timeout, both from app.query.timeout-seconds
 * - Circuit breaker (instance "analyticsDb")
 *
 * Failures are not retried here; every failure surfaces as
 * {@link QueryExecutionException}.
 */
@Slf4j
@Repository
public class AnalyticsQueryExecutor {

    private static final String QUERY_TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    @PersistenceContext
    private EntityManager entityManager;

    @Value("${app.query.timeout-seconds:10}")
    private int queryTimeoutSeconds;

    @Transactional(readOnly = true, timeoutString = "${app.query.timeout-seconds:10}")
    @CircuitBreaker(name = "analyticsDb", fallbackMethod = "executeFallback")
    public List<Object[]> execute(RenderedQuery renderedQuery) {
        Query query = entityManager.createNativeQuery(renderedQuery.getSql());
        for (Map.Entry<String, Object> parameter : renderedQuery.getParameters().entrySet()) {
            query.setParameter(parameter.getKey(), parameter.getValue());
        }
        query.setHint(QUERY_TIMEOUT_HINT, queryTimeoutSeconds * 1000);

        List<?> rows = query.getResultList();

        // Single-column selects come back as bare values, not arrays
        List<Object[]> result = new ArrayList<>(rows.size());
        for (Object row : rows) {
            result.add(row instanceof Object[] ? (Object[]) row : new Object[]{row});
        }
        return result;
    }

    /**
     * Cheap connectivity probe for the health endpoint.
     */
    @Transactional(readOnly = true, timeout = 5)
    public void ping() {
        entityManager.createNativeQuery("SELECT 1").getSingleResult();
    }

    // Fallback method (circuit breaker)

    private List<Object[]> executeFallback(RenderedQuery renderedQuery, Exception e) {
        log.error("Analytics query failed: {}", e.getMessage());
        throw new QueryExecutionException("Analytics query execution failed", e);
    }
}
