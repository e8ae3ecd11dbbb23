package com.foliogate.security;

import java.util.Set;

/**
 * The authenticated actor a request runs on behalf of, as forwarded by the upstream authenticator.
 */
public record Principal(String id, Set<String> roles) {

    public static final String STAFF_ROLE = "staff";

    public Principal {
        roles = roles != null ? Set.copyOf(roles) : Set.of();
    }

    public boolean isStaff() {
        return roles.contains(STAFF_ROLE);
    }
}
