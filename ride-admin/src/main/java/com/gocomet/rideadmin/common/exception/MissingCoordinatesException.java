package com.gocomet.rideadmin.common.exception;

public class MissingCoordinatesException extends InvalidRequestParameterException {
    public MissingCoordinatesException() {
        super("Sorting by distance requires both \"lat\" and \"lng\" query parameters.");
    }
}
