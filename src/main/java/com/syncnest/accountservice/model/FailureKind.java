package com.syncnest.accountservice.model;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Closed set of expected failure outcomes. Each kind carries the HTTP status it maps to,
 * a problem-type slug and the stable message shown to clients.
 */
@Getter
public enum FailureKind {

    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "validation-error",
            "Validation Error", "Request validation failed"),
    OTP_ALREADY_ACTIVE(HttpStatus.CONFLICT, "otp-already-active",
            "OTP Already Active", "User already has an active otp"),
    OTP_VERIFICATION_FAILED(HttpStatus.BAD_REQUEST, "otp-verification-failed",
            "OTP Verification Failed", "Otp verification failed. Expired or not created"),
    OTP_INCORRECT(HttpStatus.BAD_REQUEST, "otp-incorrect",
            "Incorrect OTP", "Incorrect OTP"),
    OTP_ATTEMPTS_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "otp-attempts-exceeded",
            "Too Many Attempts", "Too many requests for verifying otp"),
    DUPLICATE_ACCOUNT(HttpStatus.CONFLICT, "duplicate-account",
            "Duplicate Account", "Email is already registered"),
    ALREADY_VERIFIED(HttpStatus.CONFLICT, "already-verified",
            "Already Verified", "Account is already verified"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "invalid-credentials",
            "Invalid Credentials", "Invalid email or password"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error",
            "Internal Server Error", "Internal server error. Contact support");

    private static final String TYPE_BASE = "https://syncnest.dev/problems/";

    private final HttpStatus status;
    private final String slug;
    private final String title;
    private final String defaultMessage;

    FailureKind(HttpStatus status, String slug, String title, String defaultMessage) {
        this.status = status;
        this.slug = slug;
        this.title = title;
        this.defaultMessage = defaultMessage;
    }

    public String type() {
        return TYPE_BASE + slug;
    }
}
