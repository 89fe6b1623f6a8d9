package com.restaurant.analytics.domain.query;

import com.restaurant.analytics.domain.catalog.JoinRelation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Validated, fully resolved aggregate query plan.
 *
 * {@code columns} lists the output aliases: requested dimensions followed by
 * requested metrics, matching {@code selectList} one to one.
 */
@Value
@Builder
public class CompiledQuery {

    List<SelectItem> selectList;

    List<JoinRelation> joins;

    List<Condition> conditions;

    List<String> groupBy;

    OrderBy orderBy;

    int limit;

    List<String> columns;

    @Value
    public static class SelectItem {
        String expression;
        String alias;
    }

    @Value
    public static class OrderBy {
        String column;
        boolean descending;
    }
}
