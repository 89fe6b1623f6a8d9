package com.restaurant.analytics.domain.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * One conjunct of the WHERE clause. Values are never part of the SQL text;
 * the renderer turns them into bound parameters.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition {

    public enum Kind {
        ALWAYS_TRUE,
        COMPARISON,
        MEMBERSHIP
    }

    Kind kind;
    String column;
    String operator;
    String parameterName;
    Object value;
    List<?> values;

    public static Condition alwaysTrue() {
        return new Condition(Kind.ALWAYS_TRUE, null, null, null, null, List.of());
    }

    public static Condition comparison(String column, String operator, String parameterName, Object value) {
        return new Condition(Kind.COMPARISON, column, operator, parameterName, value, List.of());
    }

    /**
     * {@code column IN (values)}. An empty value list matches no rows.
     */
    public static Condition membership(String column, String parameterName, List<?> values) {
        return new Condition(Kind.MEMBERSHIP, column, "IN", parameterName, null, List.copyOf(values));
    }
}
