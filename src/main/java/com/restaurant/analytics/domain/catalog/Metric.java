package com.restaurant.analytics.domain.catalog;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of aggregate metrics a caller may request.
 *
 * This is the only place aggregate SQL is allowed to come from. Adding a
 * metric means adding a constant here; there is no runtime registration.
 */
@Getter
public enum Metric implements QueryField {

    TOTAL_REVENUE("total_revenue", "SUM(o.total_amount)"),
    TOTAL_ORDERS("total_orders", "COUNT(DISTINCT o.id)"),
    AVG_TICKET("avg_ticket", "AVG(o.total_amount)"),
    TOTAL_ITEMS("total_items", "SUM(oi.quantity)", JoinRelation.ORDER_ITEMS),
    AVG_DELIVERY_TIME("avg_delivery_time", "AVG(o.delivery_time_minutes)"),
    AVG_PREPARATION_TIME("avg_preparation_time", "AVG(o.preparation_time_minutes)"),
    AVG_RATING("avg_rating", "AVG(o.rating)"),
    DELIVERY_FEE_TOTAL("delivery_fee_total", "SUM(o.delivery_fee)"),
    DISCOUNT_TOTAL("discount_total", "SUM(o.discount_amount)"),
    TAX_TOTAL("tax_total", "SUM(o.tax_amount)"),
    UNIQUE_CUSTOMERS("unique_customers", "COUNT(DISTINCT o.customer_id)"),
    REPEAT_CUSTOMERS("repeat_customers",
            "COUNT(DISTINCT CASE WHEN customer_order_count.order_count > 1 THEN o.customer_id END)",
            JoinRelation.CUSTOMER_ORDER_COUNT),
    // Percentage of orders that reached 'delivered', 2 decimal places
    CONVERSION_RATE("conversion_rate",
            "ROUND(CAST(COUNT(DISTINCT CASE WHEN o.status = 'delivered' THEN o.id END) AS NUMERIC) * 100 "
                    + "/ NULLIF(COUNT(DISTINCT o.id), 0), 2)");

    private static final Map<String, Metric> BY_KEY;

    static {
        Map<String, Metric> byKey = new LinkedHashMap<>();
        for (Metric metric : values()) {
            byKey.put(metric.key, metric);
        }
        BY_KEY = Collections.unmodifiableMap(byKey);
    }

    private final String key;
    private final String expression;
    private final Set<JoinRelation> requiredRelations;

    Metric(String key, String expression, JoinRelation... requiredRelations) {
        this.key = key;
        this.expression = expression;
        this.requiredRelations = Collections.unmodifiableSet(JoinRelation.closure(Arrays.asList(requiredRelations)));
    }

    public static Optional<Metric> lookup(String key) {
        return Optional.ofNullable(key == null ? null : BY_KEY.get(key));
    }

    /**
     * All metric names in catalog order, for capability discovery.
     */
    public static List<String> names() {
        return new ArrayList<>(BY_KEY.keySet());
    }
}
