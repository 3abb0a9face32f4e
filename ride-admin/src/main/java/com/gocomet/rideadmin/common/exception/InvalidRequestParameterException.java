package com.gocomet.rideadmin.common.exception;

/**
 * Client-caused failure detected before any database access. Always mapped to 400.
 */
public class InvalidRequestParameterException extends RuntimeException {
    public InvalidRequestParameterException(String message) {
        super(message);
    }
}
