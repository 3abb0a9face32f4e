package com.gocomet.rideadmin.ride.repository;

import com.gocomet.rideadmin.ride.model.Ride;
import com.gocomet.rideadmin.ride.model.RideSearchCriteria;
import org.springframework.data.domain.Page;

public interface RideSearchRepository {

    /**
     * Loads one page of rides matching the criteria, rider and driver
     * fetch-joined. Issues at most two statements: the page and its count.
     */
    Page<Ride> search(RideSearchCriteria criteria);
}
