package com.restaurant.analytics.domain.catalog;

import java.util.Set;

/**
 * A queryable column: either an aggregate {@link Metric} or a grouping {@link Dimension}.
 */
public interface QueryField {

    /**
     * Public name used in requests and as the output column alias.
     */
    String getKey();

    /**
     * SQL expression over {@code o} and the aliases of its required relations.
     */
    String getExpression();

    /**
     * Relations this field cannot be computed without, prerequisites included.
     */
    Set<JoinRelation> getRequiredRelations();
}
