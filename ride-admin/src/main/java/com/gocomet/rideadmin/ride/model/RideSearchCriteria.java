package com.gocomet.rideadmin.ride.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Validated listing request. Null fields mean "not requested". A distance
 * ordering is always paired with an origin.
 */
@Getter
@Builder
@ToString
public class RideSearchCriteria {

    private final String status;
    private final String riderEmail;
    private final RideOrdering ordering;
    private final GeoPoint origin;

    // 1-based
    private final int page;
    private final int pageSize;
}
