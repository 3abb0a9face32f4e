package com.gocomet.rideadmin.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code app.rides}.
 */
@ConfigurationProperties(prefix = "app.rides")
@Validated
@Getter
@Setter
public class RideListingProperties {

    /** How far back an event may be and still be attached to a listed ride. */
    @NotNull
    private Duration eventWindow = Duration.ofHours(24);

    @Valid
    private Pagination pagination = new Pagination();

    @Getter
    @Setter
    public static class Pagination {

        @Positive
        private int defaultPageSize = 20;

        @Positive
        private int maxPageSize = 100;
    }
}
