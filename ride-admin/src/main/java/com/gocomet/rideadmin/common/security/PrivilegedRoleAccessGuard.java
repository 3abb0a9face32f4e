package com.gocomet.rideadmin.common.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Allows a caller iff they are authenticated and hold the privileged role.
 * Registered once for every {@code /api/**} route in {@link SecurityConfig}.
 */
@Component
@Slf4j
public class PrivilegedRoleAccessGuard implements AccessGuard, AuthorizationManager<RequestAuthorizationContext> {

    private final String privilegedRole;

    public PrivilegedRoleAccessGuard(@Value("${app.security.privileged-role:admin}") String privilegedRole) {
        this.privilegedRole = privilegedRole;
    }

    @Override
    public boolean permits(String identity, String role) {
        return identity != null && privilegedRole.equals(role);
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        Authentication auth = authentication.get();
        boolean authenticated = auth != null
                && auth.isAuthenticated()
                && !(auth instanceof AnonymousAuthenticationToken);
        String identity = authenticated ? auth.getName() : null;
        String role = authenticated ? roleOf(auth) : null;

        boolean granted = permits(identity, role);
        if (!granted && identity != null) {
            log.warn("User {} with role {} denied access to {}", identity, role,
                    context.getRequest().getRequestURI());
        }
        return new AuthorizationDecision(granted);
    }

    private String roleOf(Authentication auth) {
        for (GrantedAuthority authority : auth.getAuthorities()) {
            String name = authority.getAuthority();
            if (name != null && name.startsWith(RoleAuthorities.ROLE_PREFIX)) {
                return name.substring(RoleAuthorities.ROLE_PREFIX.length());
            }
        }
        return null;
    }
}
