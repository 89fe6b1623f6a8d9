package com.restaurant.analytics.domain.service;

import com.restaurant.analytics.domain.catalog.Dimension;
import com.restaurant.analytics.domain.catalog.Metric;
import com.restaurant.analytics.domain.model.MetadataResponse;
import com.restaurant.analytics.infrastructure.persistence.repository.OrderRepository;
import com.restaurant.analytics.infrastructure.persistence.repository.ProductRepository;
import com.restaurant.analytics.infrastructure.persistence.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Capability discovery: catalog names plus the filter values currently in the data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetadataService {

    private final StoreRepository storeRepository;
    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;

    @Transactional(readOnly = true, timeoutString = "${app.query.timeout-seconds:10}")
    public MetadataResponse describe() {
        List<MetadataResponse.StoreOption> stores = storeRepository.findAllByOrderByNameAsc().stream()
                .map(store -> new MetadataResponse.StoreOption(store.getId(), store.getName()))
                .collect(Collectors.toList());

        MetadataResponse.FilterOptions filters = MetadataResponse.FilterOptions.builder()
                .stores(stores)
                .channels(orderRepository.findDistinctChannels())
                .productCategories(productRepository.findDistinctCategories())
                .statuses(orderRepository.findDistinctStatuses())
                .build();

        log.debug("Metadata loaded: {} stores, {} channels", stores.size(), filters.getChannels().size());

        return MetadataResponse.builder()
                .metrics(Metric.names())
                .dimensions(Dimension.names())
                .filters(filters)
                .build();
    }
}
