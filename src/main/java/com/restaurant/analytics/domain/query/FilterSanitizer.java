package com.restaurant.analytics.domain.query;

import com.restaurant.analytics.domain.exception.InvalidFilterValueException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw caller-supplied filter values into typed conditions.
 *
 * Integer filters are coerced and rejected when not integral. String filters
 * keep only values made of letters, digits, underscores and spaces; rejected values are dropped
 * while their siblings survive. Whatever passes ends up as a bound parameter,
 * so the allow-list is a second line of defence rather than the only one.
 */
@Slf4j
@Component
public class FilterSanitizer {

    private static final Pattern INTEGER_TEXT = Pattern.compile("-?\\d+");

    /**
     * Membership condition for the given key, or empty when the value imposes
     * no constraint (null or an empty array).
     */
    public Optional<Condition> toCondition(FilterKey filterKey, Object rawValue) {
        List<Object> values = asList(rawValue);
        if (values.isEmpty()) {
            return Optional.empty();
        }

        List<?> sanitized = switch (filterKey.getValueType()) {
            case INTEGER -> sanitizeIntegers(filterKey, values);
            case STRING -> sanitizeStrings(filterKey, values);
        };

        return Optional.of(Condition.membership(filterKey.getColumn(), filterKey.getParameterName(), sanitized));
    }

    List<Integer> sanitizeIntegers(FilterKey filterKey, List<Object> values) {
        List<Integer> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(toInteger(filterKey.getKey(), value));
        }
        return result;
    }

    List<String> sanitizeStrings(FilterKey filterKey, List<Object> values) {
        List<String> result = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value instanceof String && FilterKey.ALLOWED_STRING.matcher((String) value).matches()) {
                result.add((String) value);
            } else {
                log.warn("Dropping value {} from filter '{}': outside allowed characters", value, filterKey.getKey());
            }
        }
        return result;
    }

    /**
     * Lower bound: a bare date means the start of that day.
     */
    public LocalDateTime parseStartDate(String value) {
        LocalDate date = tryParseDate(value);
        return date != null ? date.atStartOfDay() : parseDateTime("start_date", value);
    }

    /**
     * Upper bound. A bare date covers that whole day and becomes an exclusive
     * bound at the start of the following day; a date-time is used inclusively.
     */
    public EndBound parseEndDate(String value) {
        LocalDate date = tryParseDate(value);
        if (date != null) {
            return new EndBound(date.plusDays(1).atStartOfDay(), true);
        }
        return new EndBound(parseDateTime("end_date", value), false);
    }

    private static Integer toInteger(String key, Object value) {
        try {
            if (value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger) {
                return new BigInteger(value.toString()).intValueExact();
            }
            if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
                return new BigDecimal(value.toString()).intValueExact();
            }
            if (value instanceof String && INTEGER_TEXT.matcher(((String) value).trim()).matches()) {
                return Integer.valueOf(((String) value).trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidFilterValueException(key, value, "not a valid integer");
        }
        throw new InvalidFilterValueException(key, value, "expected an integer");
    }

    private static LocalDate tryParseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime parseDateTime(String field, String value) {
        try {
            return LocalDateTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidFilterValueException(field, value, "expected yyyy-MM-dd or an ISO date-time");
        }
    }

    private static List<Object> asList(Object rawValue) {
        if (rawValue == null) {
            return Collections.emptyList();
        }
        if (rawValue instanceof Collection) {
            return new ArrayList<>((Collection<?>) rawValue);
        }
        return Collections.singletonList(rawValue);
    }

    /**
     * Upper date bound and the operator it is compared with.
     */
    @Getter
    @AllArgsConstructor(access = AccessLevel.PACKAGE)
    public static class EndBound {

        private final LocalDateTime value;
        private final boolean exclusive;

        public String getOperator() {
            return exclusive ? "<" : "<=";
        }
    }
}
