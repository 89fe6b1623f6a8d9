package com.restaurant.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Dynamic analytics query as posted by the caller.
 *
 * Metric and dimension names are resolved against the catalogs at compile
 * time. Order matters: dimensions come first in the output and drive
 * GROUP BY / ORDER BY precedence, metrics follow in the order given.
 *
 * Filter values are either a scalar or a JSON array.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private List<String> metrics;
    private List<String> dimensions;
    private Map<String, Object> filters;
    private DateRange dateRange;
    private Integer limit;

    // Defaults
    public List<String> getMetrics() {
        return metrics == null ? Collections.emptyList() : metrics;
    }

    public List<String> getDimensions() {
        return dimensions == null ? Collections.emptyList() : dimensions;
    }

    public Map<String, Object> getFilters() {
        return filters == null ? Collections.emptyMap() : filters;
    }

    public DateRange getDateRange() {
        return dateRange == null ? new DateRange() : dateRange;
    }
}
