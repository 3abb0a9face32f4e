package com.gocomet.rideadmin.common.security;

/**
 * Decides whether a caller may use the admin API. Implementations must be
 * side-effect free.
 */
public interface AccessGuard {

    /**
     * @param identity the authenticated caller's name, or {@code null} when anonymous
     * @param role     the caller's role, or {@code null} when unknown
     */
    boolean permits(String identity, String role);
}
