package com.restaurant.analytics.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised for unrecognised filter keys when strict filter checking is enabled.
 */
@Getter
public class UnknownFilterKeyException extends QueryValidationException {

    private final List<String> unknownKeys;

    public UnknownFilterKeyException(List<String> unknownKeys) {
        super("Unknown filter keys: " + unknownKeys);
        this.unknownKeys = List.copyOf(unknownKeys);
    }
}
