package com.restaurant.analytics.infrastructure.persistence.repository;

import com.restaurant.analytics.infrastructure.persistence.entity.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for order lookups and the fixed-shape dashboard reports.
 *
 * The store filter is optional everywhere: a null storeId means all stores.
 * It is cast explicitly so PostgreSQL can type a null parameter.
 */
@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, Long> {

    @Query("SELECT DISTINCT o.channel FROM OrderEntity o WHERE o.channel IS NOT NULL ORDER BY o.channel")
    List<String> findDistinctChannels();

    @Query("SELECT DISTINCT o.status FROM OrderEntity o WHERE o.status IS NOT NULL ORDER BY o.status")
    List<String> findDistinctStatuses();

    /**
     * Headline metrics for a period. Always returns exactly one row:
     * orders, revenue, avg ticket, unique customers, avg delivery time, avg rating.
     */
    @Query(value = "SELECT " +
           "COUNT(DISTINCT o.id), " +
           "SUM(o.total_amount), " +
           "AVG(o.total_amount), " +
           "COUNT(DISTINCT o.customer_id), " +
           "AVG(o.delivery_time_minutes), " +
           "AVG(o.rating) " +
           "FROM orders o " +
           "WHERE o.order_date >= :from AND o.order_date < :to " +
           "AND (CAST(:storeId AS INTEGER) IS NULL OR o.store_id = CAST(:storeId AS INTEGER))",
           nativeQuery = true)
    List<Object[]> summarizePeriod(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("storeId") Integer storeId
    );

    /**
     * Best sellers by quantity: name, quantity sold, revenue.
     */
    @Query(value = "SELECT " +
           "p.name, " +
           "SUM(oi.quantity) AS quantity_sold, " +
           "SUM(oi.total_price) AS revenue " +
           "FROM order_items oi " +
           "JOIN orders o ON oi.order_id = o.id " +
           "JOIN products p ON oi.product_id = p.id " +
           "WHERE o.order_date >= :from AND o.order_date < :to " +
           "AND (CAST(:storeId AS INTEGER) IS NULL OR o.store_id = CAST(:storeId AS INTEGER)) " +
           "GROUP BY p.id, p.name " +
           "ORDER BY quantity_sold DESC " +
           "LIMIT :maxResults",
           nativeQuery = true)
    List<Object[]> findTopProducts(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("storeId") Integer storeId,
            @Param("maxResults") int maxResults
    );

    /**
     * Per-channel orders, revenue and avg delivery time, highest revenue first.
     */
    @Query(value = "SELECT " +
           "o.channel, " +
           "COUNT(DISTINCT o.id) AS orders, " +
           "SUM(o.total_amount) AS revenue, " +
           "AVG(o.delivery_time_minutes) AS avg_delivery_time " +
           "FROM orders o " +
           "WHERE o.order_date >= :from AND o.order_date < :to " +
           "AND (CAST(:storeId AS INTEGER) IS NULL OR o.store_id = CAST(:storeId AS INTEGER)) " +
           "GROUP BY o.channel " +
           "ORDER BY revenue DESC",
           nativeQuery = true)
    List<Object[]> summarizeChannels(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("storeId") Integer storeId
    );
}
