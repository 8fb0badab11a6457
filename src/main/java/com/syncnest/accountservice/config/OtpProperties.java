package com.syncnest.accountservice.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * One-time-password policy.
 *
 * <pre>
 * app:
 *   otp:
 *     ttl-seconds: 300
 *     digits: 6
 *     max-verify-attempts: 5
 *     key-prefix: "otp:users:"
 *     hash-strength: 10
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "app.otp")
public record OtpProperties(
        @DefaultValue("300") @Min(1) int ttlSeconds,            // lifetime of a pending code
        @DefaultValue("6") @Min(4) @Max(10) int digits,          // code width
        @DefaultValue("5") @Min(1) int maxVerifyAttempts,        // verification budget per code
        @DefaultValue("otp:users:") @NotBlank String keyPrefix,  // redis namespace
        @DefaultValue("10") @Min(4) @Max(31) int hashStrength    // bcrypt cost for stored codes
) {

    public String key(String identity) {
        return keyPrefix + identity;
    }
}
