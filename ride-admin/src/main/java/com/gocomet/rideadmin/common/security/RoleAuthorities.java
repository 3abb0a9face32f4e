package com.gocomet.rideadmin.common.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Maps the free-form {@code users.role} column to a Spring Security authority.
 */
public final class RoleAuthorities {

    public static final String ROLE_PREFIX = "ROLE_";

    private RoleAuthorities() {
    }

    public static GrantedAuthority fromRole(String role) {
        return new SimpleGrantedAuthority(ROLE_PREFIX + role);
    }
}
