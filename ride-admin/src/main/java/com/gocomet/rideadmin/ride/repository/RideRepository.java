package com.gocomet.rideadmin.ride.repository;

import com.gocomet.rideadmin.ride.model.Ride;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RideRepository extends JpaRepository<Ride, Long>, RideSearchRepository {

    @EntityGraph(attributePaths = {"rider", "driver"})
    Optional<Ride> findWithParticipantsById(Long id);
}
