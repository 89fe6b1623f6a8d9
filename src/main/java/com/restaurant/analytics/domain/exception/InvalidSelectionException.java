package com.restaurant.analytics.domain.exception;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request referenced metric and/or dimension names missing from the catalogs.
 *
 * Carries every offending name, not just the first one found.
 */
@Getter
public class InvalidSelectionException extends QueryValidationException {

    private final List<String> invalidMetrics;
    private final List<String> invalidDimensions;

    public InvalidSelectionException(List<String> invalidMetrics, List<String> invalidDimensions) {
        super(buildMessage(invalidMetrics, invalidDimensions));
        this.invalidMetrics = Collections.unmodifiableList(new ArrayList<>(invalidMetrics));
        this.invalidDimensions = Collections.unmodifiableList(new ArrayList<>(invalidDimensions));
    }

    private static String buildMessage(List<String> invalidMetrics, List<String> invalidDimensions) {
        StringBuilder message = new StringBuilder("Invalid query selection");
        if (!invalidMetrics.isEmpty()) {
            message.append(", unknown metrics: ").append(invalidMetrics);
        }
        if (!invalidDimensions.isEmpty()) {
            message.append(", unknown dimensions: ").append(invalidDimensions);
        }
        return message.toString();
    }
}
