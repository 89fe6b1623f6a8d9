package com.restaurant.analytics.domain.service;

import com.restaurant.analytics.domain.exception.InvalidFilterValueException;
import com.restaurant.analytics.domain.exception.InvalidSelectionException;
import com.restaurant.analytics.domain.exception.QueryExecutionException;
import com.restaurant.analytics.domain.model.DateRange;
import com.restaurant.analytics.domain.model.QueryRequest;
import com.restaurant.analytics.domain.model.QueryResponse;
import com.restaurant.analytics.domain.query.FilterSanitizer;
import com.restaurant.analytics.domain.query.QueryCompiler;
import com.restaurant.analytics.domain.query.RenderedQuery;
import com.restaurant.analytics.domain.query.SqlRenderer;
import com.restaurant.analytics.infrastructure.persistence.AnalyticsQueryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnalyticsQueryService.
 *
 * Real compiler and renderer, mocked database. Covers row shaping, the
 * response envelope and the guarantee that bad requests never reach storage.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsQueryServiceTest {

    @Mock
    private AnalyticsQueryExecutor queryExecutor;

    private MeterRegistry meterRegistry;
    private AnalyticsQueryService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        QueryCompiler compiler = new QueryCompiler(new FilterSanitizer(), 1000, false);
        service = new AnalyticsQueryService(compiler, new SqlRenderer(), queryExecutor, meterRegistry);
    }

    @Test
    void testExecute_ShapesRowsByColumn() {
        // Given
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_orders", "total_revenue"))
                .dimensions(List.of("channel"))
                .filters(Map.of("status", List.of("delivered")))
                .dateRange(DateRange.builder().startDate("2024-01-01").build())
                .build();

        List<Object[]> rows = new ArrayList<>();
        rows.add(new Object[]{"ifood", 120L, new BigDecimal("5400.50")});
        rows.add(new Object[]{"rappi", 30L, new BigDecimal("980.00")});
        when(queryExecutor.execute(any())).thenReturn(rows);

        // When
        QueryResponse response = service.execute(request);

        // Then
        assertEquals(2, response.getData().size());
        assertEquals(List.of("channel", "total_orders", "total_revenue"),
                new ArrayList<>(response.getData().get(0).keySet()));
        assertEquals("ifood", response.getData().get(0).get("channel"));
        assertEquals(120L, response.getData().get(0).get("total_orders"));
        assertEquals(new BigDecimal("980.00"), response.getData().get(1).get("total_revenue"));

        assertEquals(2, response.getMetadata().getTotalRows());
        assertEquals(List.of("channel", "total_orders", "total_revenue"), response.getMetadata().getColumns());

        assertEquals(request.getMetrics(), response.getQueryInfo().getMetricsRequested());
        assertEquals(request.getDimensions(), response.getQueryInfo().getDimensionsRequested());
        assertEquals(request.getFilters(), response.getQueryInfo().getFiltersApplied());
        assertEquals("2024-01-01", response.getQueryInfo().getDateRange().getStartDate());

        assertEquals(1.0, meterRegistry.counter("analytics.query.executed", "result", "success").count());
    }

    @Test
    void testExecute_PassesBoundParameters() {
        // Given
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_revenue"))
                .filters(Map.of("store_ids", List.of(1, 2)))
                .limit(50_000)
                .build();
        when(queryExecutor.execute(any())).thenReturn(new ArrayList<>());

        // When
        QueryResponse response = service.execute(request);

        // Then
        ArgumentCaptor<RenderedQuery> captor = ArgumentCaptor.forClass(RenderedQuery.class);
        verify(queryExecutor).execute(captor.capture());
        RenderedQuery rendered = captor.getValue();

        assertEquals(List.of(1, 2), rendered.getParameters().get("store_ids"));
        assertEquals(10_000, rendered.getParameters().get("row_limit"));
        assertTrue(rendered.getSql().contains("o.store_id IN (:store_ids)"));
        assertTrue(response.getData().isEmpty());
        assertEquals(0, response.getMetadata().getTotalRows());
    }

    @Test
    void testExecute_InvalidSelectionNeverReachesDatabase() {
        // Given
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("foo"))
                .dimensions(List.of("bar"))
                .build();

        // When
        InvalidSelectionException e = assertThrows(InvalidSelectionException.class,
                () -> service.execute(request));

        // Then
        assertEquals(List.of("foo"), e.getInvalidMetrics());
        assertEquals(List.of("bar"), e.getInvalidDimensions());
        verify(queryExecutor, never()).execute(any());
        assertEquals(1.0, meterRegistry.counter("analytics.query.rejected",
                "reason", "InvalidSelectionException").count());
    }

    @Test
    void testExecute_InvalidFilterNeverReachesDatabase() {
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_orders"))
                .filters(Map.of("store_ids", List.of("one")))
                .build();

        assertThrows(InvalidFilterValueException.class, () -> service.execute(request));

        verifyNoInteractions(queryExecutor);
    }

    @Test
    void testExecute_StorageFailureWrapped() {
        // Given
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_orders"))
                .build();
        when(queryExecutor.execute(any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> service.execute(request));

        // Then
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
        verify(queryExecutor, times(1)).execute(any());
        assertEquals(1.0, meterRegistry.counter("analytics.query.executed", "result", "error").count());
    }

    @Test
    void testExecute_ExecutionExceptionPropagatesUnchanged() {
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_orders"))
                .build();
        QueryExecutionException failure = new QueryExecutionException("circuit open", new RuntimeException());
        when(queryExecutor.execute(any())).thenThrow(failure);

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> service.execute(request));

        assertSame(failure, e);
    }

    @Test
    void testShapeRows_ShortRowPadsWithNull() {
        List<Object[]> rows = new ArrayList<>();
        rows.add(new Object[]{"ifood"});

        List<Map<String, Object>> data = AnalyticsQueryService.shapeRows(rows, List.of("channel", "total_orders"));

        assertEquals(1, data.size());
        assertTrue(data.get(0).containsKey("total_orders"));
        assertNull(data.get(0).get("total_orders"));
    }
}
