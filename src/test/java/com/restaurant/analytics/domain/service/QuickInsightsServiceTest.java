package com.restaurant.analytics.domain.service;

import com.restaurant.analytics.domain.exception.QueryValidationException;
import com.restaurant.analytics.domain.model.QuickInsightsResponse;
import com.restaurant.analytics.infrastructure.persistence.repository.OrderRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuickInsightsServiceTest {

    @Mock
    private OrderRepository orderRepository;

    private QuickInsightsService service;

    @BeforeEach
    void setUp() {
        service = new QuickInsightsService(orderRepository, new SimpleMeterRegistry());
    }

    @Test
    void testQuickInsights_ComputesChangesAndRounding() {
        // Given: current period first, previous period second
        when(orderRepository.summarizePeriod(any(), any(), isNull()))
                .thenReturn(rows(new Object[]{200L, new BigDecimal("11000.456"), new BigDecimal("55.00228"),
                        150L, new BigDecimal("34.567"), new BigDecimal("4.3333")}))
                .thenReturn(rows(new Object[]{160L, new BigDecimal("10000"), new BigDecimal("62.5"),
                        120L, null, null}));
        when(orderRepository.findTopProducts(any(), any(), isNull(), eq(5)))
                .thenReturn(rows(new Object[]{"Pizza Margherita", 420L, new BigDecimal("16800.499")}));
        when(orderRepository.summarizeChannels(any(), any(), isNull()))
                .thenReturn(rows(new Object[]{"ifood", 80L, new BigDecimal("4400.10"), null}));

        // When
        QuickInsightsResponse response = service.quickInsights(null, 30);

        // Then
        assertEquals(30, response.getPeriodDays());
        assertEquals(200L, response.getMainMetrics().getTotalOrders());
        assertEquals(11000.46, response.getMainMetrics().getTotalRevenue());
        assertEquals(55.0, response.getMainMetrics().getAvgTicket());
        assertEquals(150L, response.getMainMetrics().getUniqueCustomers());
        assertEquals(34.6, response.getMainMetrics().getAvgDeliveryTime());
        assertEquals(4.33, response.getMainMetrics().getAvgRating());

        assertEquals(10.0, response.getChanges().getRevenueChange());
        assertEquals(25.0, response.getChanges().getOrdersChange());
        assertEquals(-12.0, response.getChanges().getTicketChange());

        assertEquals(1, response.getTopProducts().size());
        assertEquals("Pizza Margherita", response.getTopProducts().get(0).getName());
        assertEquals(420L, response.getTopProducts().get(0).getQuantitySold());
        assertEquals(16800.5, response.getTopProducts().get(0).getRevenue());

        assertEquals("ifood", response.getChannelPerformance().get(0).getChannel());
        assertEquals(0.0, response.getChannelPerformance().get(0).getAvgDeliveryTime());
    }

    @Test
    void testQuickInsights_PeriodsAreAdjacentAndEqualLength() {
        // Given
        List<Object[]> empty = new ArrayList<>();
        when(orderRepository.summarizePeriod(any(), any(), eq(7))).thenReturn(empty);
        when(orderRepository.findTopProducts(any(), any(), eq(7), anyInt())).thenReturn(empty);
        when(orderRepository.summarizeChannels(any(), any(), eq(7))).thenReturn(empty);

        // When
        QuickInsightsResponse response = service.quickInsights(7, 14);

        // Then
        ArgumentCaptor<LocalDateTime> from = ArgumentCaptor.forClass(LocalDateTime.class);
        ArgumentCaptor<LocalDateTime> to = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(orderRepository, times(2)).summarizePeriod(from.capture(), to.capture(), eq(7));

        assertEquals(from.getAllValues().get(0), to.getAllValues().get(1));
        assertEquals(Duration.ofDays(14), Duration.between(from.getAllValues().get(0), to.getAllValues().get(0)));
        assertEquals(LocalDate.now().plusDays(1).atStartOfDay(), to.getAllValues().get(0));
        assertEquals(Duration.ofDays(14), Duration.between(from.getAllValues().get(1), to.getAllValues().get(1)));

        assertEquals(0L, response.getMainMetrics().getTotalOrders());
        assertEquals(0.0, response.getChanges().getRevenueChange());
        assertTrue(response.getTopProducts().isEmpty());
    }

    @Test
    void testQuickInsights_RejectsBadPeriod() {
        assertThrows(QueryValidationException.class, () -> service.quickInsights(null, 0));
        assertThrows(QueryValidationException.class, () -> service.quickInsights(null, 5000));

        verifyNoInteractions(orderRepository);
    }

    @Test
    void testPercentChange() {
        assertEquals(50.0, QuickInsightsService.percentChange(150, 100));
        assertEquals(-33.33, QuickInsightsService.percentChange(200, 300));
        assertEquals(0.0, QuickInsightsService.percentChange(10, 0));
    }

    private static List<Object[]> rows(Object[]... rows) {
        List<Object[]> result = new ArrayList<>();
        for (Object[] row : rows) {
            result.add(row);
        }
        return result;
    }
}
