package com.restaurant.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional order-date window. Both ends are inclusive; a bare date as
 * {@code endDate} covers that whole day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DateRange {

    private String startDate;
    private String endDate;
}
