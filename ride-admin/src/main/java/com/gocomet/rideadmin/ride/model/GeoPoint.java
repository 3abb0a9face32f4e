package com.gocomet.rideadmin.ride.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class GeoPoint {

    private final double latitude;
    private final double longitude;
}
