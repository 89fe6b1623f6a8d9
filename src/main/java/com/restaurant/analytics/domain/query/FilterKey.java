package com.restaurant.analytics.domain.query;

import com.restaurant.analytics.domain.catalog.JoinRelation;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Filter keys the compiler understands, with the column they constrain and
 * the shape their values must have.
 */
@Getter
public enum FilterKey {

    STORE_IDS("store_ids", "o.store_id", ValueType.INTEGER),
    CHANNELS("channels", "o.channel", ValueType.STRING),
    PRODUCT_CATEGORIES("product_categories", "p.category", ValueType.STRING, JoinRelation.PRODUCTS),
    STATUS("status", "o.status", ValueType.STRING);

    /**
     * Letters, digits, underscore and space. Applies to every string filter.
     */
    public static final Pattern ALLOWED_STRING = Pattern.compile("[\\p{L}\\p{N}_ ]+");

    public enum ValueType {
        INTEGER,
        STRING
    }

    private final String key;
    private final String column;
    private final ValueType valueType;
    private final Set<JoinRelation> requiredRelations;

    FilterKey(String key, String column, ValueType valueType, JoinRelation... requiredRelations) {
        this.key = key;
        this.column = column;
        this.valueType = valueType;
        this.requiredRelations = Collections.unmodifiableSet(JoinRelation.closure(Arrays.asList(requiredRelations)));
    }

    /**
     * Bind parameter name used by the renderer.
     */
    public String getParameterName() {
        return key;
    }

    public static Optional<FilterKey> lookup(String key) {
        return Arrays.stream(values())
                .filter(filterKey -> filterKey.key.equals(key))
                .findFirst();
    }
}
