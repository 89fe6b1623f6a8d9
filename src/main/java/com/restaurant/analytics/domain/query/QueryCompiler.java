package com.restaurant.analytics.domain.query;

import com.restaurant.analytics.domain.catalog.Dimension;
import com.restaurant.analytics.domain.catalog.JoinRelation;
import com.restaurant.analytics.domain.catalog.Metric;
import com.restaurant.analytics.domain.catalog.QueryField;
import com.restaurant.analytics.domain.exception.InvalidSelectionException;
import com.restaurant.analytics.domain.exception.QueryValidationException;
import com.restaurant.analytics.domain.exception.UnknownFilterKeyException;
import com.restaurant.analytics.domain.model.DateRange;
import com.restaurant.analytics.domain.model.QueryRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Compiles a {@link QueryRequest} into a single aggregate query plan.
 *
 * Compile Flow:
 * 1. Resolve every metric and dimension name; report all unknown names together
 * 2. Select list: dimensions, then metrics, in request order
 * 3. Joins: only the relations the selected fields and applied filters depend on
 * 4. Predicate: 1 = 1, date bounds, one membership condition per known filter
 * 5. GROUP BY dimensions; ORDER BY first dimension ASC, else first metric DESC
 * 6. Limit clamped to {@link #MAX_LIMIT}
 *
 * Stateless apart from configuration; safe to share across request threads.
 */
@Slf4j
@Component
public class QueryCompiler {

    public static final int MAX_LIMIT = 10_000;

    private final FilterSanitizer filterSanitizer;
    private final int defaultLimit;
    private final boolean rejectUnknownFilters;

    public QueryCompiler(FilterSanitizer filterSanitizer,
                         @Value("${app.query.default-limit:1000}") int defaultLimit,
                         @Value("${app.query.reject-unknown-filters:false}") boolean rejectUnknownFilters) {
        this.filterSanitizer = filterSanitizer;
        this.defaultLimit = Math.min(defaultLimit, MAX_LIMIT);
        this.rejectUnknownFilters = rejectUnknownFilters;
    }

    public CompiledQuery compile(QueryRequest request) {
        List<Dimension> dimensions = new ArrayList<>();
        List<Metric> metrics = new ArrayList<>();
        List<String> invalidDimensions = resolve(request.getDimensions(), Dimension::lookup, dimensions);
        List<String> invalidMetrics = resolve(request.getMetrics(), Metric::lookup, metrics);

        if (!invalidMetrics.isEmpty() || !invalidDimensions.isEmpty()) {
            throw new InvalidSelectionException(invalidMetrics, invalidDimensions);
        }
        if (metrics.isEmpty() && dimensions.isEmpty()) {
            throw new QueryValidationException("At least one metric or dimension must be requested");
        }

        List<QueryField> selected = new ArrayList<>(dimensions);
        selected.addAll(metrics);

        List<CompiledQuery.SelectItem> selectList = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        for (QueryField field : selected) {
            selectList.add(new CompiledQuery.SelectItem(field.getExpression(), field.getKey()));
            columns.add(field.getKey());
        }

        List<String> groupBy = new ArrayList<>();
        for (Dimension dimension : dimensions) {
            groupBy.add(dimension.getExpression());
        }

        CompiledQuery.OrderBy orderBy = dimensions.isEmpty()
                ? new CompiledQuery.OrderBy(metrics.get(0).getKey(), true)
                : new CompiledQuery.OrderBy(dimensions.get(0).getKey(), false);

        Set<JoinRelation> joins = EnumSet.noneOf(JoinRelation.class);
        for (QueryField field : selected) {
            joins.addAll(field.getRequiredRelations());
        }
        List<Condition> conditions = buildConditions(request, joins);

        return CompiledQuery.builder()
                .selectList(List.copyOf(selectList))
                .joins(List.copyOf(joins))
                .conditions(conditions)
                .groupBy(List.copyOf(groupBy))
                .orderBy(orderBy)
                .limit(resolveLimit(request.getLimit()))
                .columns(List.copyOf(columns))
                .build();
    }

    int resolveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, MAX_LIMIT);
    }

    /**
     * Resolves names in order, dropping repeats; returns the names that did not resolve.
     */
    private static <T> List<String> resolve(List<String> names,
                                            Function<String, Optional<T>> lookup,
                                            List<T> resolved) {
        List<String> invalid = new ArrayList<>();
        for (String name : new LinkedHashSet<>(names)) {
            Optional<T> field = lookup.apply(name);
            if (field.isPresent()) {
                resolved.add(field.get());
            } else {
                invalid.add(name);
            }
        }
        return invalid;
    }

    /**
     * Builds the WHERE conjuncts, adding the relations applied filters read from to {@code joins}.
     */
    private List<Condition> buildConditions(QueryRequest request, Set<JoinRelation> joins) {
        List<Condition> conditions = new ArrayList<>();
        conditions.add(Condition.alwaysTrue());

        DateRange dateRange = request.getDateRange();
        if (hasText(dateRange.getStartDate())) {
            LocalDateTime start = filterSanitizer.parseStartDate(dateRange.getStartDate());
            conditions.add(Condition.comparison("o.order_date", ">=", "start_date", start));
        }
        if (hasText(dateRange.getEndDate())) {
            FilterSanitizer.EndBound end = filterSanitizer.parseEndDate(dateRange.getEndDate());
            conditions.add(Condition.comparison("o.order_date", end.getOperator(), "end_date", end.getValue()));
        }

        Map<String, Object> filters = request.getFilters();
        checkFilterKeys(filters);

        // Catalog order, not request order, so equal requests compile identically
        for (FilterKey filterKey : FilterKey.values()) {
            if (!filters.containsKey(filterKey.getKey())) {
                continue;
            }
            Optional<Condition> condition = filterSanitizer.toCondition(filterKey, filters.get(filterKey.getKey()));
            if (condition.isPresent()) {
                conditions.add(condition.get());
                joins.addAll(filterKey.getRequiredRelations());
            }
        }
        return List.copyOf(conditions);
    }

    private void checkFilterKeys(Map<String, Object> filters) {
        List<String> unknown = new ArrayList<>();
        for (String key : filters.keySet()) {
            if (FilterKey.lookup(key).isEmpty()) {
                unknown.add(key);
            }
        }
        if (unknown.isEmpty()) {
            return;
        }
        if (rejectUnknownFilters) {
            throw new UnknownFilterKeyException(unknown);
        }
        log.warn("Ignoring unknown filter keys: {}", unknown);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
