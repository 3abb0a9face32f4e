package com.gocomet.rideadmin.common.exception;

public class InvalidPaginationException extends InvalidRequestParameterException {
    public InvalidPaginationException(String parameter, String value) {
        super(String.format("\"%s\" must be a positive integer, got \"%s\".", parameter, value));
    }
}
