package com.syncnest.accountservice.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Delivery settings for one-time codes. With {@code enabled=false} codes are only logged.
 */
@Validated
@ConfigurationProperties(prefix = "app.mail")
public record OtpMailProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("no-reply@syncnest.dev") @NotBlank String from,
        @DefaultValue("Your verification code") @NotBlank String subject,
        @DefaultValue("templates/otp-email.html") @NotBlank String template,
        @DefaultValue("2") @Min(0) int maxRetries,
        @DefaultValue("60s") @NotNull Duration initialBackoff
) {

    /** Delay before retry number {@code attempt} (0-based): initial * 2^attempt. */
    public Duration backoffFor(int attempt) {
        return initialBackoff.multipliedBy(1L << Math.min(attempt, 20));
    }
}
