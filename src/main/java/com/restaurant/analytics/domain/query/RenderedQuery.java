package com.restaurant.analytics.domain.query;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * SQL text with named parameters, ready for the database.
 */
@Value
public class RenderedQuery {

    String sql;
    Map<String, Object> parameters;
    List<String> columns;
}
