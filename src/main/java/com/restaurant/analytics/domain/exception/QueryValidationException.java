package com.restaurant.analytics.domain.exception;

/**
 * Caller error detected while compiling a request. Always raised before
 * anything is sent to the database.
 */
public class QueryValidationException extends RuntimeException {

    public QueryValidationException(String message) {
        super(message);
    }
}
