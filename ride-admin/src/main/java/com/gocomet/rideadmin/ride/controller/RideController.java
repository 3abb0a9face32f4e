package com.gocomet.rideadmin.ride.controller;

import com.gocomet.rideadmin.common.dto.PagedResponse;
import com.gocomet.rideadmin.ride.dto.RideListParams;
import com.gocomet.rideadmin.ride.dto.RideResponse;
import com.gocomet.rideadmin.ride.service.RideService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/api/rides")
@RequiredArgsConstructor
public class RideController {

    private final RideService rideService;

    /**
     * GET /api/rides: page of rides with events from the last 24 hours.
     * Parameters arrive as raw strings so malformed values get a 400 with a readable message.
     */
    @GetMapping
    public ResponseEntity<PagedResponse<RideResponse>> listRides(
            @RequestParam(required = false) String status,
            @RequestParam(name = "rider_email", required = false) String riderEmail,
            @RequestParam(required = false) String ordering,
            @RequestParam(required = false) String lat,
            @RequestParam(required = false) String lng,
            @RequestParam(required = false) String page,
            @RequestParam(name = "page_size", required = false) String pageSize) {
        RideListParams params = RideListParams.builder()
                .status(status)
                .riderEmail(riderEmail)
                .ordering(ordering)
                .lat(lat)
                .lng(lng)
                .page(page)
                .pageSize(pageSize)
                .build();
        return ResponseEntity.ok(rideService.listRides(params, ServletUriComponentsBuilder.fromCurrentRequest()));
    }

    /**
     * GET /api/rides/{id}: single ride
     */
    @GetMapping("/{id}")
    public ResponseEntity<RideResponse> getRide(@PathVariable Long id) {
        return ResponseEntity.ok(rideService.getRide(id));
    }
}
