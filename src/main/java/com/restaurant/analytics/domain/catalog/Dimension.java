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
 * Catalog of grouping dimensions: plain columns and time buckets over {@code o.order_date}.
 */
@Getter
public enum Dimension implements QueryField {

    STORE("store", "s.name", JoinRelation.STORES),
    STORE_ID("store_id", "o.store_id"),
    CHANNEL("channel", "o.channel"),
    PRODUCT("product", "p.name", JoinRelation.PRODUCTS),
    PRODUCT_CATEGORY("product_category", "p.category", JoinRelation.PRODUCTS),
    CUSTOMER_CITY("customer_city", "c.city", JoinRelation.CUSTOMERS),
    ORDER_STATUS("order_status", "o.status"),
    HOUR("hour", "EXTRACT(HOUR FROM o.order_date)"),
    DAY_OF_WEEK("day_of_week", "EXTRACT(DOW FROM o.order_date)"),
    DAY("day", "DATE(o.order_date)"),
    WEEK("week", "DATE_TRUNC('week', o.order_date)"),
    MONTH("month", "DATE_TRUNC('month', o.order_date)"),
    QUARTER("quarter", "DATE_TRUNC('quarter', o.order_date)");

    private static final Map<String, Dimension> BY_KEY;

    static {
        Map<String, Dimension> byKey = new LinkedHashMap<>();
        for (Dimension dimension : values()) {
            byKey.put(dimension.key, dimension);
        }
        BY_KEY = Collections.unmodifiableMap(byKey);
    }

    private final String key;
    private final String expression;
    private final Set<JoinRelation> requiredRelations;

    Dimension(String key, String expression, JoinRelation... requiredRelations) {
        this.key = key;
        this.expression = expression;
        this.requiredRelations = Collections.unmodifiableSet(JoinRelation.closure(Arrays.asList(requiredRelations)));
    }

    public static Optional<Dimension> lookup(String key) {
        return Optional.ofNullable(key == null ? null : BY_KEY.get(key));
    }

    public static List<String> names() {
        return new ArrayList<>(BY_KEY.keySet());
    }
}
