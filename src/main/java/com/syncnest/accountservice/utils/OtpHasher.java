package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.config.OtpProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted one-way hashing of one-time codes. Both operations are CPU-bound and are meant to
 * be run through {@link CpuBoundExecutor}.
 */
@Component
public class OtpHasher {

    private final BCryptPasswordEncoder encoder;

    public OtpHasher(OtpProperties props) {
        this.encoder = new BCryptPasswordEncoder(props.hashStrength());
    }

    public String hash(String code) {
        return encoder.encode(code);
    }

    /** Constant-time comparison of a candidate against a stored hash. */
    public boolean matches(String candidate, String hashed) {
        if (candidate == null || hashed == null) {
            return false;
        }
        return encoder.matches(candidate, hashed);
    }
}
