package com.gocomet.rideadmin.ride.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * Immutable timeline entry of a {@link Ride}.
 *
 * <p>{@code rideId} mirrors the foreign key column so events can be grouped
 * by ride without touching the lazy {@code ride} association.
 */
@Entity
@Table(name = "ride_events", indexes = {
        @Index(name = "idx_ride_events_ride_created", columnList = "ride_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RideEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ride_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Ride ride;

    @Column(name = "ride_id", insertable = false, updatable = false)
    private Long rideId;

    @Column(nullable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
