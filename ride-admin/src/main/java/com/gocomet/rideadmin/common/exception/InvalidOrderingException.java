package com.gocomet.rideadmin.common.exception;

import java.util.Collection;

public class InvalidOrderingException extends InvalidRequestParameterException {
    public InvalidOrderingException(String ordering, Collection<String> allowed) {
        super(String.format("Invalid ordering \"%s\". Allowed values: %s", ordering, String.join(", ", allowed)));
    }
}
