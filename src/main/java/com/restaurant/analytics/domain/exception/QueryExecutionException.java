package com.restaurant.analytics.domain.exception;

/**
 * The database call for a compiled query failed. No partial results are returned.
 */
public class QueryExecutionException extends RuntimeException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
