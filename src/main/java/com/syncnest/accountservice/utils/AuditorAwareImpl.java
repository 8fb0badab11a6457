package com.syncnest.accountservice.utils;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Auditor for JPA audit columns: the authenticated account's e-mail, or {@code SYSTEM}
 * for anonymous flows such as registration.
 */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    static final String SYSTEM = "SYSTEM";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            return Optional.of(SYSTEM);
        }
        Object principal = auth.getPrincipal();
        if (principal instanceof UserDetails ud && ud.getUsername() != null && !ud.getUsername().isBlank()) {
            return Optional.of("USER:" + ud.getUsername());
        }
        return Optional.of(SYSTEM);
    }
}
