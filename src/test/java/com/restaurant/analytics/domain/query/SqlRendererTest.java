package com.restaurant.analytics.domain.query;

import com.restaurant.analytics.domain.model.DateRange;
import com.restaurant.analytics.domain.model.QueryRequest;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlRendererTest {

    private final QueryCompiler compiler = new QueryCompiler(new FilterSanitizer(), 1000, false);
    private final SqlRenderer renderer = new SqlRenderer();

    @Test
    void testRender_GroupedQuery() {
        // Given
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_orders", "total_revenue"))
                .dimensions(List.of("channel"))
                .filters(Map.of("status", List.of("delivered")))
                .dateRange(DateRange.builder().startDate("2024-01-01").build())
                .build();

        // When
        RenderedQuery rendered = renderer.render(compiler.compile(request));
        String sql = rendered.getSql();

        // Then
        assertTrue(sql.startsWith("SELECT o.channel AS channel, COUNT(DISTINCT o.id) AS total_orders, "
                + "SUM(o.total_amount) AS total_revenue\nFROM orders o\nWHERE 1 = 1"));
        assertFalse(sql.contains("JOIN"));
        assertTrue(sql.contains("WHERE 1 = 1\n  AND o.order_date >= :start_date\n  AND o.status IN (:status)\n"));
        assertTrue(sql.contains("GROUP BY o.channel\n"));
        assertTrue(sql.contains("ORDER BY channel ASC\n"));
        assertTrue(sql.endsWith("LIMIT :row_limit"));

        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), rendered.getParameters().get("start_date"));
        assertEquals(List.of("delivered"), rendered.getParameters().get("status"));
        assertEquals(1000, rendered.getParameters().get("row_limit"));
        assertEquals(List.of("channel", "total_orders", "total_revenue"), rendered.getColumns());
    }

    @Test
    void testRender_JoinsInGraphOrder() {
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_items"))
                .dimensions(List.of("product_category", "customer_city", "store"))
                .build();

        String sql = renderer.render(compiler.compile(request)).getSql();

        assertTrue(sql.contains("FROM orders o\n"
                + "LEFT JOIN stores s ON o.store_id = s.id\n"
                + "LEFT JOIN customers c ON o.customer_id = c.id\n"
                + "LEFT JOIN order_items oi ON o.id = oi.order_id\n"
                + "LEFT JOIN products p ON oi.product_id = p.id\n"
                + "WHERE"));
    }

    @Test
    void testRender_UngroupedQueryWithAuxiliaryJoin() {
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("repeat_customers"))
                .build();

        String sql = renderer.render(compiler.compile(request)).getSql();

        assertTrue(sql.contains("customer_order_count ON o.customer_id = customer_order_count.customer_id"));
        assertFalse(sql.contains("GROUP BY"));
        assertTrue(sql.contains("ORDER BY repeat_customers DESC\n"));
    }

    @Test
    void testRender_CallerTextNeverInSql() {
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_orders"))
                .filters(Map.of(
                        "channels", List.of("ifood", "rappi"),
                        "product_categories", List.of("Pizza Especial")))
                .build();

        RenderedQuery rendered = renderer.render(compiler.compile(request));

        assertFalse(rendered.getSql().contains("ifood"));
        assertFalse(rendered.getSql().contains("Pizza"));
        assertTrue(rendered.getSql().contains("o.channel IN (:channels)"));
        assertTrue(rendered.getSql().contains("p.category IN (:product_categories)"));
        assertTrue(rendered.getSql().contains("FROM orders o\n"
                + "LEFT JOIN order_items oi ON o.id = oi.order_id\n"
                + "LEFT JOIN products p ON oi.product_id = p.id\n"));
        assertEquals(List.of("ifood", "rappi"), rendered.getParameters().get("channels"));
    }

    @Test
    void testRender_EmptyMembershipMatchesNothing() {
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("total_orders"))
                .filters(Map.of("status", List.of("bad value!")))
                .build();

        RenderedQuery rendered = renderer.render(compiler.compile(request));

        assertTrue(rendered.getSql().contains("AND 1 = 0"));
        assertFalse(rendered.getParameters().containsKey("status"));
    }

    @Test
    void testRender_Deterministic() {
        QueryRequest request = QueryRequest.builder()
                .metrics(List.of("avg_rating"))
                .dimensions(List.of("store", "day_of_week"))
                .filters(Map.of("store_ids", List.of(4, 5)))
                .limit(20)
                .build();

        RenderedQuery first = renderer.render(compiler.compile(request));
        RenderedQuery second = renderer.render(compiler.compile(request));

        assertEquals(first, second);
        assertEquals(20, first.getParameters().get("row_limit"));
    }
}
