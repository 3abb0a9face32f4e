package com.gocomet.rideadmin.ride.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.rideadmin.ride.model.Ride;
import com.gocomet.rideadmin.ride.model.RideEvent;
import com.gocomet.rideadmin.ride.repository.RideEventRepository;
import com.gocomet.rideadmin.ride.repository.RideRepository;
import com.gocomet.rideadmin.user.model.User;
import com.gocomet.rideadmin.user.repository.UserRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import org.hibernate.SessionFactory;
import org.hibernate.stat.Statistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class RideControllerIntegrationTest {

    private static final String RIDES = "/api/rides";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private RideRepository rideRepository;

    @Autowired
    private RideEventRepository rideEventRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private EntityManagerFactory entityManagerFactory;

    private User rider;
    private User driver;
    private Ride rideNear;
    private Ride rideFar;

    @BeforeEach
    void setUp() {
        Instant now = Instant.now();

        userRepository.save(User.builder()
                .username("admin")
                .password(passwordEncoder.encode("pass"))
                .email("admin@example.com")
                .role("admin")
                .build());
        rider = userRepository.save(User.builder()
                .username("rider")
                .password(passwordEncoder.encode("pass"))
                .email("rider@example.com")
                .build());
        driver = userRepository.save(User.builder()
                .username("driver")
                .password(passwordEncoder.encode("pass"))
                .email("driver@example.com")
                .build());

        // One near the origin, one farther away
        rideNear = rideRepository.save(Ride.builder()
                .status("en-route")
                .rider(rider)
                .driver(driver)
                .pickupLatitude(0.0)
                .pickupLongitude(0.0)
                .pickupTime(now.minus(Duration.ofMinutes(30)))
                .build());
        rideFar = rideRepository.save(Ride.builder()
                .status("pickup")
                .rider(rider)
                .driver(driver)
                .pickupLatitude(10.0)
                .pickupLongitude(10.0)
                .pickupTime(now.minus(Duration.ofHours(2)))
                .build());

        // Recent and old events for rideNear; only old for rideFar
        event(rideNear, "Status changed to pickup", now);
        event(rideNear, "Some old event", now.minus(Duration.ofDays(2)));
        event(rideFar, "Status changed to pickup", now.minus(Duration.ofDays(3)));

        flushAndClear();
    }

    private void event(Ride ride, String description, Instant createdAt) {
        rideEventRepository.save(RideEvent.builder()
                .ride(ride)
                .description(description)
                .createdAt(createdAt)
                .build());
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    private Statistics statistics() {
        return entityManagerFactory.unwrap(SessionFactory.class).getStatistics();
    }

    private JsonNode okResults(String url) throws Exception {
        MvcResult result = mockMvc.perform(get(url))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("results");
    }

    private static JsonNode find(JsonNode results, Long rideId) {
        for (JsonNode ride : results) {
            if (ride.get("id").asLong() == rideId) {
                return ride;
            }
        }
        return null;
    }

    private static List<Long> ids(JsonNode results) {
        List<Long> ids = new ArrayList<>();
        results.forEach(ride -> ids.add(ride.get("id").asLong()));
        return ids;
    }

    // ── Core functionality ──────────────────────────────────────────

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void listReturnsTodaysEventsOnly() throws Exception {
        JsonNode found = find(okResults(RIDES), rideNear.getId());

        assertNotNull(found);
        List<String> descriptions = new ArrayList<>();
        found.get("events").forEach(e -> descriptions.add(e.get("description").asText()));
        assertEquals(List.of("Status changed to pickup"), descriptions);
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void ridesWithOnlyOldEventsHaveEmptyEvents() throws Exception {
        JsonNode found = find(okResults(RIDES), rideFar.getId());

        assertNotNull(found);
        assertTrue(found.get("events").isArray());
        assertEquals(0, found.get("events").size());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void listIncludesNestedParticipantsAndEnvelope() throws Exception {
        mockMvc.perform(get(RIDES))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.next").value(nullValue()))
                .andExpect(jsonPath("$.previous").value(nullValue()))
                .andExpect(jsonPath("$.results[0].rider.email").value("rider@example.com"))
                .andExpect(jsonPath("$.results[0].rider.role").value("user"))
                .andExpect(jsonPath("$.results[0].rider.password").doesNotExist())
                .andExpect(jsonPath("$.results[0].driver.username").value("driver"))
                .andExpect(jsonPath("$.results[0].dropoff_latitude").isEmpty())
                .andExpect(jsonPath("$.results[0].events[0].created_at").isString());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void repeatedRequestsReturnSameOrder() throws Exception {
        for (int i = 0; i < 3; i++) {
            rideRepository.save(Ride.builder().status("pickup").pickupLatitude(1.0).pickupLongitude(1.0).build());
        }
        flushAndClear();

        String url = RIDES + "?ordering=distance&lat=0&lng=0";
        assertEquals(ids(okResults(url)), ids(okResults(url)));
    }

    // ── Filtering ───────────────────────────────────────────────────

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void filterByStatus() throws Exception {
        JsonNode results = okResults(RIDES + "?status=pickup");

        assertEquals(List.of(rideFar.getId()), ids(results));
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void filterByStatusIsExactMatch() throws Exception {
        assertEquals(0, okResults(RIDES + "?status=pick").size());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void filterByRiderEmail() throws Exception {
        User other = userRepository.save(User.builder()
                .username("other").password("x").email("other@example.com").build());
        rideRepository.save(Ride.builder()
                .status("pickup").rider(other).pickupLatitude(5.0).pickupLongitude(5.0).build());
        flushAndClear();

        JsonNode results = okResults(RIDES + "?rider_email=rider@example.com");

        assertEquals(2, results.size());
        results.forEach(r -> assertEquals("rider@example.com", r.get("rider").get("email").asText()));
    }

    // ── Ordering ────────────────────────────────────────────────────

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void orderingByPickupTime() throws Exception {
        assertEquals(List.of(rideFar.getId(), rideNear.getId()), ids(okResults(RIDES + "?ordering=pickup_time")));
        assertEquals(List.of(rideNear.getId(), rideFar.getId()), ids(okResults(RIDES + "?ordering=-pickup_time")));
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void orderingByDistance() throws Exception {
        JsonNode results = okResults(RIDES + "?ordering=distance&lat=0&lng=0");
        assertEquals(rideNear.getId(), results.get(0).get("id").asLong());

        JsonNode reversed = okResults(RIDES + "?ordering=-distance&lat=9.5&lng=9.5");
        assertEquals(rideNear.getId(), reversed.get(0).get("id").asLong());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void orderingByDistanceWithoutLatLngReturns400() throws Exception {
        statistics().clear();

        mockMvc.perform(get(RIDES + "?ordering=distance"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error")
                        .value("Sorting by distance requires both \"lat\" and \"lng\" query parameters."));

        assertEquals(0, statistics().getPrepareStatementCount());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void orderingByDistanceWithInvalidLatLngReturns400() throws Exception {
        mockMvc.perform(get(RIDES + "?ordering=distance&lat=abc&lng=xyz"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("\"lat\" and \"lng\" must be valid numeric values."));
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void unknownOrderingReturns400() throws Exception {
        mockMvc.perform(get(RIDES + "?ordering=status"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").isString());
    }

    // ── Pagination ──────────────────────────────────────────────────

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void paginationLinks() throws Exception {
        mockMvc.perform(get(RIDES + "?page_size=1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.results.length()").value(1))
                .andExpect(jsonPath("$.next").value("http://localhost/api/rides?page_size=1&page=2"))
                .andExpect(jsonPath("$.previous").value(nullValue()));

        mockMvc.perform(get(RIDES + "?page_size=1&page=2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].id").value(rideFar.getId()))
                .andExpect(jsonPath("$.next").value(nullValue()))
                .andExpect(jsonPath("$.previous").value("http://localhost/api/rides?page_size=1"));
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void invalidPageSizeReturns400() throws Exception {
        mockMvc.perform(get(RIDES + "?page_size=0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void pageBeyondLastReturns404() throws Exception {
        mockMvc.perform(get(RIDES + "?page=5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invalid page."));
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void pageWithOffsetBeyondIntRangeReturns404() throws Exception {
        statistics().clear();

        mockMvc.perform(get(RIDES + "?page=268435457&page_size=16"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invalid page."));
        mockMvc.perform(get(RIDES + "?page=2147483647&page_size=100"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invalid page."));

        assertEquals(0, statistics().getPrepareStatementCount());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void oversizedPageSizeIsClamped() throws Exception {
        mockMvc.perform(get(RIDES + "?page_size=3000000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.results.length()").value(2));
    }

    // ── Single ride ─────────────────────────────────────────────────

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void retrieveFiltersEventsToWindow() throws Exception {
        mockMvc.perform(get(RIDES + "/" + rideNear.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(rideNear.getId()))
                .andExpect(jsonPath("$.events.length()").value(1))
                .andExpect(jsonPath("$.events[0].description").value("Status changed to pickup"));
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void retrieveUnknownRideReturns404() throws Exception {
        mockMvc.perform(get(RIDES + "/999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Ride not found with id: 999999"));
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void retrieveNonNumericIdReturns400() throws Exception {
        mockMvc.perform(get(RIDES + "/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void rideSurvivesRiderDeletion() throws Exception {
        userRepository.deleteById(rider.getId());
        flushAndClear();

        mockMvc.perform(get(RIDES + "/" + rideFar.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rider").value(nullValue()))
                .andExpect(jsonPath("$.driver.username").value("driver"));
    }

    // ── Authentication / Permissions ────────────────────────────────

    @Test
    void unauthenticatedUserDenied() throws Exception {
        mockMvc.perform(get(RIDES))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists("WWW-Authenticate"))
                .andExpect(jsonPath("$.error").isString());
    }

    @Test
    @WithMockUser(username = "rider", roles = "user")
    void nonAdminUserDenied() throws Exception {
        mockMvc.perform(get(RIDES))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("You do not have permission to perform this action."));
    }

    @Test
    void basicCredentialsResolveRoleFromUsersTable() throws Exception {
        mockMvc.perform(get(RIDES).with(httpBasic("admin", "pass")))
                .andExpect(status().isOk());
        mockMvc.perform(get(RIDES).with(httpBasic("rider", "pass")))
                .andExpect(status().isForbidden());
        mockMvc.perform(get(RIDES).with(httpBasic("admin", "wrong")))
                .andExpect(status().isUnauthorized());
    }

    // ── Performance ─────────────────────────────────────────────────

    @Test
    @WithMockUser(username = "admin", roles = "admin")
    void fullPageCostsAtMostThreeStatements() throws Exception {
        Instant now = Instant.now();
        for (int i = 0; i < 25; i++) {
            Ride ride = rideRepository.save(Ride.builder()
                    .status("en-route").rider(rider).driver(driver)
                    .pickupLatitude((double) i).pickupLongitude((double) i)
                    .build());
            event(ride, "recent " + i, now.minus(Duration.ofMinutes(i)));
            event(ride, "old " + i, now.minus(Duration.ofDays(3)));
        }
        flushAndClear();
        statistics().clear();

        JsonNode results = okResults(RIDES);

        assertEquals(20, results.size());
        long statements = statistics().getPrepareStatementCount();
        assertTrue(statements <= 3, "Expected at most 3 statements, got " + statements);
        results.forEach(r -> assertTrue(r.get("events").size() <= 1));
    }
}
