package com.restaurant.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result of a dynamic analytics query.
 *
 * Each row in {@code data} is keyed by the compiled output columns, in order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private List<Map<String, Object>> data;
    private Metadata metadata;
    private QueryInfo queryInfo;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private int totalRows;
        private List<String> columns;
        private long executionTimeMs;
    }

    /**
     * Echo of what the caller asked for.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QueryInfo {
        private List<String> metricsRequested;
        private List<String> dimensionsRequested;
        private Map<String, Object> filtersApplied;
        private DateRange dateRange;
    }
}
