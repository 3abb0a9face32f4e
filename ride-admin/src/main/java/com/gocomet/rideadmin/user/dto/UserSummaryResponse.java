package com.gocomet.rideadmin.user.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserSummaryResponse {

    private Long id;
    private String username;
    private String firstName;
    private String lastName;
    private String email;
    private String role;
    private String phoneNumber;
}
