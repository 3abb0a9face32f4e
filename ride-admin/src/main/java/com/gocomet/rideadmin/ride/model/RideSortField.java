package com.gocomet.rideadmin.ride.model;

public enum RideSortField {
    PICKUP_TIME("pickup_time"),
    DISTANCE("distance");

    private final String parameterName;

    RideSortField(String parameterName) {
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
