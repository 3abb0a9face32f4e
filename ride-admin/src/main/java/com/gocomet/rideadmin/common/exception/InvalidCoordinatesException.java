package com.gocomet.rideadmin.common.exception;

public class InvalidCoordinatesException extends InvalidRequestParameterException {
    public InvalidCoordinatesException() {
        super("\"lat\" and \"lng\" must be valid numeric values.");
    }
}
