package com.gocomet.rideadmin.user.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_users_username", columnList = "username", unique = true),
        @Index(name = "idx_users_email", columnList = "email", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    public static final String DEFAULT_ROLE = "user";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 150)
    private String username;

    // BCrypt hash
    @Column(nullable = false)
    private String password;

    @Column(name = "first_name", length = 150)
    @Builder.Default
    private String firstName = "";

    @Column(name = "last_name", length = 150)
    @Builder.Default
    private String lastName = "";

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false, length = 32)
    @Builder.Default
    private String role = DEFAULT_ROLE;

    @Column(name = "phone_number", nullable = false, length = 32)
    @Builder.Default
    private String phoneNumber = "";

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
