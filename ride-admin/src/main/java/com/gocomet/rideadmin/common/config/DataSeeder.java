package com.gocomet.rideadmin.common.config;

import com.gocomet.rideadmin.ride.model.Ride;
import com.gocomet.rideadmin.ride.model.RideEvent;
import com.gocomet.rideadmin.ride.repository.RideEventRepository;
import com.gocomet.rideadmin.ride.repository.RideRepository;
import com.gocomet.rideadmin.user.model.User;
import com.gocomet.rideadmin.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Seeds the database with demo data on startup.
 * Uses Bangalore coordinates for realistic testing.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    private final UserRepository userRepository;
    private final RideRepository rideRepository;
    private final RideEventRepository rideEventRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Value("${app.seed.admin-password}")
    private String adminPassword;

    @Override
    @Transactional
    public void run(String... args) {
        if (userRepository.count() > 0) {
            log.info("Database already seeded. Skipping.");
            return;
        }

        log.info("Seeding database with demo data...");
        Instant now = clock.instant();

        userRepository.save(User.builder()
                .username("admin")
                .password(passwordEncoder.encode(adminPassword))
                .email("admin@test.com")
                .role("admin")
                .build());

        User rider = userRepository.save(User.builder()
                .username("ashish")
                .password(passwordEncoder.encode(adminPassword))
                .firstName("Ashish")
                .email("ashish@test.com")
                .phoneNumber("+919876543210")
                .build());

        User driver = userRepository.save(User.builder()
                .username("raju")
                .password(passwordEncoder.encode(adminPassword))
                .firstName("Raju")
                .email("raju@driver.com")
                .phoneNumber("+919800000001")
                .build());

        Ride koramangala = rideRepository.save(Ride.builder()
                .status("en-route")
                .rider(rider)
                .driver(driver)
                .pickupLatitude(12.9352)  // Koramangala
                .pickupLongitude(77.6245)
                .pickupTime(now.minus(Duration.ofMinutes(30)))
                .build());

        Ride mgRoad = rideRepository.save(Ride.builder()
                .status("dropoff")
                .rider(rider)
                .driver(driver)
                .pickupLatitude(12.9716)  // MG Road
                .pickupLongitude(77.5946)
                .dropoffLatitude(12.9279) // HSR Layout
                .dropoffLongitude(77.6271)
                .pickupTime(now.minus(Duration.ofDays(2)))
                .build());

        rideRepository.save(Ride.builder()
                .status("pickup")
                .rider(rider)
                .pickupLatitude(12.9344)  // BTM Layout
                .pickupLongitude(77.6101)
                .build());

        rideEventRepository.save(RideEvent.builder()
                .ride(koramangala)
                .description("Status changed to pickup")
                .createdAt(now.minus(Duration.ofMinutes(20)))
                .build());
        rideEventRepository.save(RideEvent.builder()
                .ride(koramangala)
                .description("Status changed to en-route")
                .createdAt(now.minus(Duration.ofMinutes(5)))
                .build());
        rideEventRepository.save(RideEvent.builder()
                .ride(mgRoad)
                .description("Status changed to dropoff")
                .createdAt(now.minus(Duration.ofDays(2)))
                .build());

        log.info("Seeded {} users, {} rides and {} ride events",
                userRepository.count(), rideRepository.count(), rideEventRepository.count());
    }
}
