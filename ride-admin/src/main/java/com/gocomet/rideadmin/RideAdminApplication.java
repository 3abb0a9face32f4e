package com.gocomet.rideadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RideAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(RideAdminApplication.class, args);
    }
}
