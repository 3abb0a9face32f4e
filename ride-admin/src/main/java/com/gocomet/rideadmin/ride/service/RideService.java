package com.gocomet.rideadmin.ride.service;

import com.gocomet.rideadmin.common.config.RideListingProperties;
import com.gocomet.rideadmin.common.dto.PagedResponse;
import com.gocomet.rideadmin.common.exception.ResourceNotFoundException;
import com.gocomet.rideadmin.ride.dto.RideListParams;
import com.gocomet.rideadmin.ride.dto.RideResponse;
import com.gocomet.rideadmin.ride.model.Ride;
import com.gocomet.rideadmin.ride.model.RideEvent;
import com.gocomet.rideadmin.ride.model.RideSearchCriteria;
import com.gocomet.rideadmin.ride.repository.RideEventRepository;
import com.gocomet.rideadmin.ride.repository.RideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class RideService {

        private final RideRepository rideRepository;
        private final RideEventRepository rideEventRepository;
        private final RideQueryValidator rideQueryValidator;
        private final RideResponseAssembler rideResponseAssembler;
        private final RideListingProperties properties;
        private final Clock clock;

        /**
         * List one page of rides with their recent events.
         * 1. Validate parameters (no database access)
         * 2. Count + load the page, rider and driver joined
         * 3. Load the page's events inside the window in one query
         * 4. Assemble the page envelope
         */
        public PagedResponse<RideResponse> listRides(RideListParams params, UriComponentsBuilder requestUri) {
                RideSearchCriteria criteria = rideQueryValidator.validate(params);
                Instant threshold = eventWindowStart();

                Page<Ride> page = rideRepository.search(criteria);
                if (page.isEmpty() && criteria.getPage() > 1) {
                        throw new ResourceNotFoundException("Invalid page.");
                }

                Map<Long, List<RideEvent>> eventsByRide = recentEventsByRide(page.getContent(), threshold);
                log.info("Listed {} of {} rides (page {}, {} recent events)",
                                page.getNumberOfElements(), page.getTotalElements(), criteria.getPage(),
                                eventsByRide.values().stream().mapToInt(List::size).sum());

                return rideResponseAssembler.toPagedResponse(page, eventsByRide, requestUri);
        }

        /**
         * Get a single ride. Filters the ride's full event collection in
         * memory, one extra query for this ride only; listings never use this path.
         */
        @Transactional(readOnly = true)
        public RideResponse getRide(Long rideId) {
                Ride ride = rideRepository.findWithParticipantsById(rideId)
                                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));

                Instant threshold = eventWindowStart();
                List<RideEvent> recent = ride.getEvents().stream()
                                .filter(event -> !event.getCreatedAt().isBefore(threshold))
                                .toList();
                return rideResponseAssembler.toResponse(ride, recent);
        }

        private Map<Long, List<RideEvent>> recentEventsByRide(List<Ride> rides, Instant threshold) {
                if (rides.isEmpty()) {
                        return Map.of();
                }
                List<Long> rideIds = rides.stream().map(Ride::getId).toList();
                return rideEventRepository.findRecentByRideIds(rideIds, threshold)
                                .stream()
                                .collect(Collectors.groupingBy(RideEvent::getRideId));
        }

        // Read once per request so the query and any in-memory filtering agree.
        private Instant eventWindowStart() {
                return clock.instant().minus(properties.getEventWindow());
        }
}
