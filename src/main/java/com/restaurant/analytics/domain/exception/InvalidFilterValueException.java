package com.restaurant.analytics.domain.exception;

import lombok.Getter;

/**
 * A typed filter (store ids, date bounds) received a value of the wrong shape.
 */
@Getter
public class InvalidFilterValueException extends QueryValidationException {

    private final String filterKey;
    private final transient Object rejectedValue;

    public InvalidFilterValueException(String filterKey, Object rejectedValue, String reason) {
        super("Invalid value for filter '" + filterKey + "': " + rejectedValue + " (" + reason + ")");
        this.filterKey = filterKey;
        this.rejectedValue = rejectedValue;
    }
}
