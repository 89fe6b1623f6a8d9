package com.restaurant.analytics.domain.catalog;

import lombok.Getter;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Relations that can be joined onto {@code orders o}.
 *
 * Declaration order is the join graph order. Nothing is joined unless a
 * requested field or filter depends on it, so order-level aggregates are not
 * multiplied by item rows.
 */
@Getter
public enum JoinRelation {

    STORES("LEFT JOIN stores s ON o.store_id = s.id", null),
    CUSTOMERS("LEFT JOIN customers c ON o.customer_id = c.id", null),
    ORDER_ITEMS("LEFT JOIN order_items oi ON o.id = oi.order_id", null),
    PRODUCTS("LEFT JOIN products p ON oi.product_id = p.id", ORDER_ITEMS),

    /**
     * Per-customer order count over the whole order history.
     */
    CUSTOMER_ORDER_COUNT(
            "LEFT JOIN (SELECT customer_id, COUNT(*) AS order_count FROM orders GROUP BY customer_id) "
                    + "customer_order_count ON o.customer_id = customer_order_count.customer_id",
            null);

    private final String clause;

    /**
     * Relation whose alias this clause joins through, or null when it joins {@code o} directly.
     */
    private final JoinRelation prerequisite;

    JoinRelation(String clause, JoinRelation prerequisite) {
        this.clause = clause;
        this.prerequisite = prerequisite;
    }

    /**
     * The given relations plus everything they join through, in graph order.
     */
    public static Set<JoinRelation> closure(Collection<JoinRelation> relations) {
        Set<JoinRelation> closed = EnumSet.noneOf(JoinRelation.class);
        for (JoinRelation relation : relations) {
            for (JoinRelation current = relation; current != null; current = current.prerequisite) {
                closed.add(current);
            }
        }
        return closed;
    }
}
