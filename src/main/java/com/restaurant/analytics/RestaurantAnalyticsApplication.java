package com.restaurant.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Restaurant Analytics API
 *
 * Lets dashboards ask for aggregate business metrics (revenue, orders,
 * ratings, ...) grouped by business dimensions (store, channel, time
 * bucket, ...) without ever sending SQL.
 *
 * Architecture:
 * - Metric and dimension catalogs as the only source of SQL expressions
 * - Query compiler: validation, minimal join set, sanitized filters
 * - Renderer with bound parameters for every caller-supplied value
 * - Hard row cap of 10,000 per query
 * - Fixed-shape quick insights for the main dashboard
 */
@SpringBootApplication
public class RestaurantAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestaurantAnalyticsApplication.class, args);
    }
}
