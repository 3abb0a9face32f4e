package com.gocomet.rideadmin.ride.model;

import com.gocomet.rideadmin.common.exception.InvalidOrderingException;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A requested sort key, parsed from {@code ordering}. A leading {@code -}
 * means descending.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class RideOrdering {

    private final RideSortField field;
    private final boolean descending;

    /**
     * @return the parsed ordering, or {@code null} when none was requested
     * @throws InvalidOrderingException for anything but the allowed keys
     */
    public static RideOrdering parse(String ordering) {
        if (ordering == null || ordering.isBlank()) {
            return null;
        }
        String value = ordering.trim();
        boolean descending = value.startsWith("-");
        String name = descending ? value.substring(1) : value;
        for (RideSortField field : RideSortField.values()) {
            if (field.getParameterName().equals(name)) {
                return new RideOrdering(field, descending);
            }
        }
        throw new InvalidOrderingException(value, allowedValues());
    }

    public static List<String> allowedValues() {
        List<String> allowed = new ArrayList<>();
        for (RideSortField field : RideSortField.values()) {
            allowed.add(field.getParameterName());
            allowed.add("-" + field.getParameterName());
        }
        return allowed;
    }

    public boolean isDistance() {
        return field == RideSortField.DISTANCE;
    }
}
