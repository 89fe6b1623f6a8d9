package com.restaurant.analytics.domain.query;

import com.restaurant.analytics.domain.catalog.JoinRelation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link CompiledQuery} as PostgreSQL with named parameters.
 *
 * Only catalog expressions, fixed join clauses and parameter placeholders
 * reach the SQL text. Every caller-supplied value goes into the parameter map.
 */
@Component
public class SqlRenderer {

    public RenderedQuery render(CompiledQuery query) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        StringBuilder sql = new StringBuilder();

        List<String> selectParts = new ArrayList<>();
        for (CompiledQuery.SelectItem item : query.getSelectList()) {
            selectParts.add(item.getExpression() + " AS " + item.getAlias());
        }
        sql.append("SELECT ").append(String.join(", ", selectParts)).append("\n");

        sql.append("FROM orders o");
        for (JoinRelation join : query.getJoins()) {
            sql.append("\n").append(join.getClause());
        }
        sql.append("\n");

        List<String> predicates = new ArrayList<>();
        for (Condition condition : query.getConditions()) {
            predicates.add(renderCondition(condition, parameters));
        }
        sql.append("WHERE ").append(String.join("\n  AND ", predicates)).append("\n");

        if (!query.getGroupBy().isEmpty()) {
            sql.append("GROUP BY ").append(String.join(", ", query.getGroupBy())).append("\n");
        }

        CompiledQuery.OrderBy orderBy = query.getOrderBy();
        if (orderBy != null) {
            sql.append("ORDER BY ").append(orderBy.getColumn())
                    .append(orderBy.isDescending() ? " DESC" : " ASC").append("\n");
        }

        sql.append("LIMIT :row_limit");
        parameters.put("row_limit", query.getLimit());

        return new RenderedQuery(sql.toString(), parameters, query.getColumns());
    }

    private static String renderCondition(Condition condition, Map<String, Object> parameters) {
        return switch (condition.getKind()) {
            case ALWAYS_TRUE -> "1 = 1";
            case COMPARISON -> {
                parameters.put(condition.getParameterName(), condition.getValue());
                yield condition.getColumn() + " " + condition.getOperator() + " :" + condition.getParameterName();
            }
            case MEMBERSHIP -> {
                if (condition.getValues().isEmpty()) {
                    // Every supplied value was rejected
                    yield "1 = 0";
                }
                parameters.put(condition.getParameterName(), condition.getValues());
                yield condition.getColumn() + " IN (:" + condition.getParameterName() + ")";
            }
        };
    }
}
