package com.restaurant.analytics.domain.service;

import com.restaurant.analytics.domain.exception.QueryExecutionException;
import com.restaurant.analytics.domain.exception.QueryValidationException;
import com.restaurant.analytics.domain.model.QueryRequest;
import com.restaurant.analytics.domain.model.QueryResponse;
import com.restaurant.analytics.domain.query.CompiledQuery;
import com.restaurant.analytics.domain.query.QueryCompiler;
import com.restaurant.analytics.domain.query.RenderedQuery;
import com.restaurant.analytics.domain.query.SqlRenderer;
import com.restaurant.analytics.infrastructure.persistence.AnalyticsQueryExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dynamic analytics queries.
 *
 * Query Flow:
 * 1. Compile the request (all validation happens here, nothing touches the database)
 * 2. Render the plan to SQL with bound parameters
 * 3. Execute against PostgreSQL
 * 4. Shape rows into records keyed by the compiled column names
 *
 * Results are not cached and failed executions are not retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsQueryService {

    private final QueryCompiler queryCompiler;
    private final SqlRenderer sqlRenderer;
    private final AnalyticsQueryExecutor queryExecutor;
    private final MeterRegistry meterRegistry;

    public QueryResponse execute(QueryRequest request) {
        CompiledQuery compiled;
        try {
            compiled = queryCompiler.compile(request);
        } catch (QueryValidationException e) {
            log.info("Rejected analytics query: {}", e.getMessage());

            Counter.builder("analytics.query.rejected")
                    .tag("reason", e.getClass().getSimpleName())
                    .register(meterRegistry)
                    .increment();
            throw e;
        }

        RenderedQuery rendered = sqlRenderer.render(compiled);
        log.debug("Compiled analytics query:\n{}\nparameters: {}", rendered.getSql(), rendered.getParameters());

        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        List<Object[]> rows;
        try {
            rows = queryExecutor.execute(rendered);
        } catch (QueryExecutionException e) {
            recordFailure();
            throw e;
        } catch (Exception e) {
            log.error("Error executing analytics query: {}", e.getMessage(), e);
            recordFailure();
            throw new QueryExecutionException("Analytics query execution failed", e);
        }

        long queryTime = System.currentTimeMillis() - startTime;

        sample.stop(Timer.builder("analytics.query.latency")
                .tag("grouped", String.valueOf(!compiled.getGroupBy().isEmpty()))
                .register(meterRegistry));

        Counter.builder("analytics.query.executed")
                .tag("result", "success")
                .register(meterRegistry)
                .increment();

        List<Map<String, Object>> data = shapeRows(rows, compiled.getColumns());

        log.info("Analytics query executed: {} rows, {} columns, {} ms",
                data.size(), compiled.getColumns().size(), queryTime);

        return QueryResponse.builder()
                .data(data)
                .metadata(QueryResponse.Metadata.builder()
                        .totalRows(data.size())
                        .columns(compiled.getColumns())
                        .executionTimeMs(queryTime)
                        .build())
                .queryInfo(QueryResponse.QueryInfo.builder()
                        .metricsRequested(request.getMetrics())
                        .dimensionsRequested(request.getDimensions())
                        .filtersApplied(request.getFilters())
                        .dateRange(request.getDateRange())
                        .build())
                .build();
    }

    /**
     * Row-to-record projection. Column order follows the compiled query.
     */
    static List<Map<String, Object>> shapeRows(List<Object[]> rows, List<String> columns) {
        List<Map<String, Object>> data = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                record.put(columns.get(i), i < row.length ? row[i] : null);
            }
            data.add(record);
        }
        return data;
    }

    private void recordFailure() {
        Counter.builder("analytics.query.executed")
                .tag("result", "error")
                .register(meterRegistry)
                .increment();
    }
}
