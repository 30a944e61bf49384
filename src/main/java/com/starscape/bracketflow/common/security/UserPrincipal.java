package com.starscape.bracketflow.common.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.security.Principal;
import java.util.Collection;
import java.util.List;

/**
 * Authenticated caller resolved from a bearer token. Jobs are owned by {@link #getUserId()}.
 */
public final class UserPrincipal implements Principal {

    private static final String SCOPE_PREFIX = "SCOPE_";

    private final String userId;
    private final String email;
    private final List<String> scopes;

    public UserPrincipal(String userId, String email, List<String> scopes) {
        this.userId = userId;
        this.email = email;
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    /**
     * Token scopes as {@code SCOPE_*} authorities.
     */
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return scopes.stream()
                .map(scope -> new SimpleGrantedAuthority(SCOPE_PREFIX + scope))
                .toList();
    }

    @Override
    public String getName() {
        return userId;
    }

    @Override
    public String toString() {
        return "UserPrincipal[" + userId + "]";
    }
}
