package com.gocomet.rideadmin.ride.repository;

import com.gocomet.rideadmin.ride.model.RideEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface RideEventRepository extends JpaRepository<RideEvent, Long> {

    /**
     * Events of the given rides created at or after {@code threshold}.
     * Bounded by the number of ride ids, never by the size of the event table.
     */
    @Query("SELECT e FROM RideEvent e WHERE e.rideId IN :rideIds AND e.createdAt >= :threshold "
            + "ORDER BY e.createdAt ASC, e.id ASC")
    List<RideEvent> findRecentByRideIds(@Param("rideIds") Collection<Long> rideIds,
                                        @Param("threshold") Instant threshold);
}
