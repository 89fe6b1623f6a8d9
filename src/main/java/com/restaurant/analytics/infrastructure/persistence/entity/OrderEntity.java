package com.restaurant.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Customer order, the fact table every analytics query starts from.
 *
 * Indexing Strategy (maintained by the schema scripts):
 * - order_date for date-range filters and time buckets
 * - (store_id, order_date) for per-store dashboards
 * - channel and status for membership filters
 */
@Entity
@Table(name = "orders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    @Id
    private Long id;

    @Column(name = "store_id", nullable = false)
    private Integer storeId;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(length = 30)
    private String channel;

    @Column(length = 30)
    private String status;

    @Column(name = "order_date", nullable = false)
    private LocalDateTime orderDate;

    @Column(name = "total_amount", precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "delivery_time_minutes")
    private Integer deliveryTimeMinutes;

    @Column(name = "preparation_time_minutes")
    private Integer preparationTimeMinutes;

    private Integer rating;
}
