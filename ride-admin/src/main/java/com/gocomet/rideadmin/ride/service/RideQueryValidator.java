package com.gocomet.rideadmin.ride.service;

import com.gocomet.rideadmin.common.config.RideListingProperties;
import com.gocomet.rideadmin.common.exception.InvalidCoordinatesException;
import com.gocomet.rideadmin.common.exception.InvalidPaginationException;
import com.gocomet.rideadmin.common.exception.MissingCoordinatesException;
import com.gocomet.rideadmin.common.exception.ResourceNotFoundException;
import com.gocomet.rideadmin.ride.dto.RideListParams;
import com.gocomet.rideadmin.ride.model.GeoPoint;
import com.gocomet.rideadmin.ride.model.RideOrdering;
import com.gocomet.rideadmin.ride.model.RideSearchCriteria;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Turns raw listing parameters into {@link RideSearchCriteria}.
 * Never touches the database, so a rejected request costs no round trip.
 */
@Component
@RequiredArgsConstructor
public class RideQueryValidator {

    private final RideListingProperties properties;

    public RideSearchCriteria validate(RideListParams params) {
        RideOrdering ordering = RideOrdering.parse(params.getOrdering());

        boolean latPresent = params.getLat() != null;
        boolean lngPresent = params.getLng() != null;
        if (ordering != null && ordering.isDistance() && (!latPresent || !lngPresent)) {
            throw new MissingCoordinatesException();
        }

        Double lat = latPresent ? parseCoordinate(params.getLat()) : null;
        Double lng = lngPresent ? parseCoordinate(params.getLng()) : null;
        GeoPoint origin = lat != null && lng != null ? new GeoPoint(lat, lng) : null;

        RideListingProperties.Pagination pagination = properties.getPagination();
        BigInteger requestedSize = parsePositive("page_size", params.getPageSize());
        int pageSize = requestedSize == null
                ? pagination.getDefaultPageSize()
                : requestedSize.min(BigInteger.valueOf(pagination.getMaxPageSize())).intValueExact();

        BigInteger requestedPage = parsePositive("page", params.getPage());
        int page = requestedPage == null ? 1 : reachablePage(requestedPage, pageSize);

        return RideSearchCriteria.builder()
                .status(blankToNull(params.getStatus()))
                .riderEmail(blankToNull(params.getRiderEmail()))
                .ordering(ordering)
                .origin(origin)
                .page(page)
                .pageSize(pageSize)
                .build();
    }

    // BigDecimal rejects NaN, Infinity and Java literal suffixes that Double.parseDouble would accept.
    private Double parseCoordinate(String raw) {
        try {
            double value = new BigDecimal(raw.trim()).doubleValue();
            if (!Double.isFinite(value)) {
                throw new InvalidCoordinatesException();
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new InvalidCoordinatesException();
        }
    }

    private BigInteger parsePositive(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            BigInteger value = new BigInteger(raw.trim());
            if (value.signum() < 1) {
                throw new InvalidPaginationException(name, raw);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new InvalidPaginationException(name, raw);
        }
    }

    // Row offsets are ints in JPA; a page starting past Integer.MAX_VALUE cannot hold any row.
    private int reachablePage(BigInteger page, int pageSize) {
        BigInteger maxInt = BigInteger.valueOf(Integer.MAX_VALUE);
        BigInteger offset = page.subtract(BigInteger.ONE).multiply(BigInteger.valueOf(pageSize));
        if (page.compareTo(maxInt) > 0 || offset.compareTo(maxInt) > 0) {
            throw new ResourceNotFoundException("Invalid page.");
        }
        return page.intValueExact();
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
