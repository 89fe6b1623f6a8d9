package com.restaurant.analytics.api;

import com.restaurant.analytics.domain.model.MetadataResponse;
import com.restaurant.analytics.domain.model.QueryRequest;
import com.restaurant.analytics.domain.model.QueryResponse;
import com.restaurant.analytics.domain.model.QuickInsightsResponse;
import com.restaurant.analytics.domain.service.AnalyticsQueryService;
import com.restaurant.analytics.domain.service.MetadataService;
import com.restaurant.analytics.domain.service.QuickInsightsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for analytics queries.
 *
 * Endpoints:
 * - POST /api/query - Dynamic metric/dimension query
 * - GET /api/metadata - Available metrics, dimensions and filter values
 * - GET /api/quick-insights - Dashboard summary for the last N days
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsQueryService analyticsQueryService;
    private final MetadataService metadataService;
    private final QuickInsightsService quickInsightsService;

    /**
     * Execute a dynamic query.
     *
     * POST /api/query
     *
     * Request body:
     * {
     *   "metrics": ["total_orders", "total_revenue"],
     *   "dimensions": ["channel"],
     *   "filters": {"status": ["delivered"], "store_ids": [1, 2]},
     *   "date_range": {"start_date": "2024-01-01", "end_date": "2024-01-31"},
     *   "limit": 100
     * }
     *
     * Response:
     * - data: one record per row, keyed by column name
     * - metadata: total_rows, columns, execution_time_ms
     * - query_info: echo of the request
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> executeQuery(@RequestBody QueryRequest request) {
        log.info("Query: metrics={}, dimensions={}, filters={}",
                request.getMetrics(), request.getDimensions(), request.getFilters().keySet());

        return ResponseEntity.ok(analyticsQueryService.execute(request));
    }

    /**
     * GET /api/metadata
     */
    @GetMapping("/metadata")
    public ResponseEntity<MetadataResponse> getMetadata() {
        return ResponseEntity.ok(metadataService.describe());
    }

    /**
     * Dashboard summary.
     *
     * GET /api/quick-insights?store_id=3&days=30
     *
     * Query Parameters:
     * - store_id (optional): Restrict to one store
     * - days (optional): Period length in days (default: 30)
     */
    @GetMapping("/quick-insights")
    public ResponseEntity<QuickInsightsResponse> getQuickInsights(
            @RequestParam(name = "store_id", required = false) Integer storeId,
            @RequestParam(name = "days", defaultValue = "30") int days) {

        log.info("Quick insights: storeId={}, days={}", storeId, days);

        return ResponseEntity.ok(quickInsightsService.quickInsights(storeId, days));
    }
}
