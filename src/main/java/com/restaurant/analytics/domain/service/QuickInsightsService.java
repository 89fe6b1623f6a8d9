package com.restaurant.analytics.domain.service;

import com.restaurant.analytics.domain.exception.QueryValidationException;
import com.restaurant.analytics.domain.model.QuickInsightsResponse;
import com.restaurant.analytics.infrastructure.persistence.repository.OrderRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dashboard summary for the last N days.
 *
 * Unlike {@link AnalyticsQueryService} these are fixed, parameterized reports:
 * - Headline metrics for the current period
 * - Change against the preceding period of the same length
 * - Top products by quantity sold
 * - Performance per sales channel
 *
 * Periods are whole days: the current one is the last {@code days} days
 * including today, the previous one the {@code days} days before it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuickInsightsService {

    public static final int MAX_DAYS = 3650;
    static final int TOP_PRODUCTS = 5;

    private final OrderRepository orderRepository;
    private final MeterRegistry meterRegistry;

    @Transactional(readOnly = true, timeoutString = "${app.query.timeout-seconds:10}")
    public QuickInsightsResponse quickInsights(Integer storeId, int days) {
        if (days < 1 || days > MAX_DAYS) {
            throw new QueryValidationException("days must be between 1 and " + MAX_DAYS + ", got " + days);
        }

        Timer.Sample sample = Timer.start(meterRegistry);

        LocalDate today = LocalDate.now();
        LocalDateTime periodEnd = today.plusDays(1).atStartOfDay();
        LocalDateTime periodStart = today.minusDays(days - 1L).atStartOfDay();
        LocalDateTime previousStart = periodStart.minusDays(days);

        Object[] current = firstRow(orderRepository.summarizePeriod(periodStart, periodEnd, storeId));
        Object[] previous = firstRow(orderRepository.summarizePeriod(previousStart, periodStart, storeId));

        long currentOrders = toLong(current[0]);
        double currentRevenue = toDouble(current[1]);
        double currentTicket = toDouble(current[2]);

        QuickInsightsResponse.MainMetrics mainMetrics = QuickInsightsResponse.MainMetrics.builder()
                .totalOrders(currentOrders)
                .totalRevenue(round(currentRevenue, 2))
                .avgTicket(round(currentTicket, 2))
                .uniqueCustomers(toLong(current[3]))
                .avgDeliveryTime(round(toDouble(current[4]), 1))
                .avgRating(round(toDouble(current[5]), 2))
                .build();

        QuickInsightsResponse.Changes changes = QuickInsightsResponse.Changes.builder()
                .revenueChange(percentChange(currentRevenue, toDouble(previous[1])))
                .ordersChange(percentChange(currentOrders, toLong(previous[0])))
                .ticketChange(percentChange(currentTicket, toDouble(previous[2])))
                .build();

        List<QuickInsightsResponse.TopProduct> topProducts = orderRepository
                .findTopProducts(periodStart, periodEnd, storeId, TOP_PRODUCTS).stream()
                .map(row -> new QuickInsightsResponse.TopProduct(
                        (String) row[0],
                        toLong(row[1]),
                        round(toDouble(row[2]), 2)))
                .collect(Collectors.toList());

        List<QuickInsightsResponse.ChannelPerformance> channels = orderRepository
                .summarizeChannels(periodStart, periodEnd, storeId).stream()
                .map(row -> new QuickInsightsResponse.ChannelPerformance(
                        (String) row[0],
                        toLong(row[1]),
                        round(toDouble(row[2]), 2),
                        round(toDouble(row[3]), 1)))
                .collect(Collectors.toList());

        sample.stop(Timer.builder("analytics.insights.latency")
                .tag("store_filter", String.valueOf(storeId != null))
                .register(meterRegistry));

        log.info("Quick insights computed: storeId={}, days={}, orders={}", storeId, days, currentOrders);

        return QuickInsightsResponse.builder()
                .periodDays(days)
                .mainMetrics(mainMetrics)
                .changes(changes)
                .topProducts(topProducts)
                .channelPerformance(channels)
                .build();
    }

    /**
     * (current - previous) / previous * 100, two decimals; 0 without a positive baseline.
     */
    static double percentChange(double current, double previous) {
        if (previous <= 0) {
            return 0;
        }
        return round((current - previous) / previous * 100, 2);
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    // Aggregates over an empty period come back as NULL
    private static Object[] firstRow(List<Object[]> rows) {
        return rows.isEmpty() ? new Object[6] : rows.get(0);
    }

    private static long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static double toDouble(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
}
