package com.restaurant.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Capability discovery for query builders: what can be selected and which
 * filter values currently exist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetadataResponse {

    private List<String> metrics;
    private List<String> dimensions;
    private FilterOptions filters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FilterOptions {
        private List<StoreOption> stores;
        private List<String> channels;
        private List<String> productCategories;
        private List<String> statuses;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoreOption {
        private Integer id;
        private String name;
    }
}
