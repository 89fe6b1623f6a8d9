package com.restaurant.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Fixed-shape dashboard summary for the last {@code periodDays} days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuickInsightsResponse {

    private int periodDays;
    private MainMetrics mainMetrics;
    private Changes changes;
    private List<TopProduct> topProducts;
    private List<ChannelPerformance> channelPerformance;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MainMetrics {
        private long totalOrders;
        private double totalRevenue;
        private double avgTicket;
        private long uniqueCustomers;
        private double avgDeliveryTime;
        private double avgRating;
    }

    /**
     * Percentage change against the preceding period of the same length.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Changes {
        private double revenueChange;
        private double ordersChange;
        private double ticketChange;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopProduct {
        private String name;
        private long quantitySold;
        private double revenue;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelPerformance {
        private String channel;
        private long orders;
        private double revenue;
        private double avgDeliveryTime;
    }
}
