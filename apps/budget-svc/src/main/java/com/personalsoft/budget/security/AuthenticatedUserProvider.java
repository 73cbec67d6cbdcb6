package com.personalsoft.budget.security;

import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Tenant lookup for services; a bean so tests can stub the current user. */
@Component
public class AuthenticatedUserProvider {

    public UUID requireCurrentUserId() {
        return currentUserId().orElseThrow(() -> new UnauthenticatedException("user context missing"));
    }

    public Optional<UUID> currentUserId() {
        return RequestContextHolder.userId();
    }
}
