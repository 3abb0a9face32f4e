package com.gocomet.rideadmin.ride.model;

import com.gocomet.rideadmin.user.model.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A trip record. Rider and driver are cleared, not cascaded, when the
 * referenced user is deleted, so a ride outlives its participants.
 */
@Entity
@Table(name = "rides", indexes = {
        @Index(name = "idx_rides_status", columnList = "status"),
        @Index(name = "idx_rides_rider_id", columnList = "rider_id"),
        @Index(name = "idx_rides_driver_id", columnList = "driver_id"),
        @Index(name = "idx_rides_pickup_time", columnList = "pickup_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String status;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "rider_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User rider;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "driver_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User driver;

    @Column(name = "pickup_latitude", nullable = false)
    private Double pickupLatitude;

    @Column(name = "pickup_longitude", nullable = false)
    private Double pickupLongitude;

    @Column(name = "dropoff_latitude")
    private Double dropoffLatitude;

    @Column(name = "dropoff_longitude")
    private Double dropoffLongitude;

    @Column(name = "pickup_time")
    private Instant pickupTime;

    // Full timeline. Only the single-ride path reads this; listings use the windowed query.
    @OneToMany(mappedBy = "ride", cascade = CascadeType.REMOVE)
    @OrderBy("createdAt ASC, id ASC")
    @Builder.Default
    private List<RideEvent> events = new ArrayList<>();
}
