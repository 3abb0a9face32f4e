package com.gocomet.rideadmin.ride.service;

import com.gocomet.rideadmin.common.dto.PagedResponse;
import com.gocomet.rideadmin.ride.dto.RideEventResponse;
import com.gocomet.rideadmin.ride.dto.RideResponse;
import com.gocomet.rideadmin.ride.model.Ride;
import com.gocomet.rideadmin.ride.model.RideEvent;
import com.gocomet.rideadmin.user.dto.UserSummaryResponse;
import com.gocomet.rideadmin.user.model.User;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

/**
 * Shapes loaded rides into their wire representation. Pure: reads only what
 * the caller already loaded and never touches lazy associations beyond
 * rider and driver.
 */
@Component
public class RideResponseAssembler {

    static final String PAGE_PARAM = "page";

    public PagedResponse<RideResponse> toPagedResponse(Page<Ride> page,
                                                       Map<Long, List<RideEvent>> eventsByRide,
                                                       UriComponentsBuilder requestUri) {
        List<RideResponse> results = page.getContent().stream()
                .map(ride -> toResponse(ride, eventsByRide.getOrDefault(ride.getId(), List.of())))
                .toList();

        // Page is 0-based; the query parameter is 1-based.
        int current = page.getNumber() + 1;
        return PagedResponse.<RideResponse>builder()
                .count(page.getTotalElements())
                .next(page.hasNext() ? pageLink(requestUri, current + 1) : null)
                .previous(page.hasPrevious() ? pageLink(requestUri, current - 1) : null)
                .results(results)
                .build();
    }

    public RideResponse toResponse(Ride ride, List<RideEvent> events) {
        return RideResponse.builder()
                .id(ride.getId())
                .status(ride.getStatus())
                .rider(toUserSummary(ride.getRider()))
                .driver(toUserSummary(ride.getDriver()))
                .pickupLatitude(ride.getPickupLatitude())
                .pickupLongitude(ride.getPickupLongitude())
                .dropoffLatitude(ride.getDropoffLatitude())
                .dropoffLongitude(ride.getDropoffLongitude())
                .pickupTime(ride.getPickupTime())
                .events(events.stream().map(this::toEventResponse).toList())
                .build();
    }

    private RideEventResponse toEventResponse(RideEvent event) {
        return RideEventResponse.builder()
                .id(event.getId())
                .description(event.getDescription())
                .createdAt(event.getCreatedAt())
                .build();
    }

    private UserSummaryResponse toUserSummary(User user) {
        if (user == null) {
            return null;
        }
        return UserSummaryResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .email(user.getEmail())
                .role(user.getRole())
                .phoneNumber(user.getPhoneNumber())
                .build();
    }

    private String pageLink(UriComponentsBuilder requestUri, int pageNumber) {
        UriComponentsBuilder link = requestUri.cloneBuilder();
        if (pageNumber == 1) {
            link.replaceQueryParam(PAGE_PARAM);
        } else {
            link.replaceQueryParam(PAGE_PARAM, pageNumber);
        }
        return link.build().toUriString();
    }
}
