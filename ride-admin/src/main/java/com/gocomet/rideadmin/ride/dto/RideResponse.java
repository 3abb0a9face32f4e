package com.gocomet.rideadmin.ride.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gocomet.rideadmin.user.dto.UserSummaryResponse;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RideResponse {

    private Long id;
    private String status;
    private UserSummaryResponse rider;
    private UserSummaryResponse driver;
    private Double pickupLatitude;
    private Double pickupLongitude;
    private Double dropoffLatitude;
    private Double dropoffLongitude;
    private Instant pickupTime;

    // Events from the last 24 hours only; empty, never null.
    @Builder.Default
    private List<RideEventResponse> events = new ArrayList<>();
}
