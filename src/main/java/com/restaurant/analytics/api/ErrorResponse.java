package com.restaurant.analytics.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;
    private String message;
    private long timestamp;

    // Populated for invalid_selection only
    private List<String> invalidMetrics;
    private List<String> invalidDimensions;

    // Populated for filter errors only
    private String filterKey;
    private List<String> unknownKeys;
}
