package com.gocomet.rideadmin.ride.dto;

import lombok.*;

/**
 * Raw query-string parameters of the ride listing, before validation.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RideListParams {

    private String status;
    private String riderEmail;
    private String ordering;
    private String lat;
    private String lng;
    private String page;
    private String pageSize;
}
