package com.syncnest.accountservice.service;

/**
 * State machine for one-time codes per identity: {@code absent -> pending(attempts) -> consumed}.
 * Works on hashed codes only; generation and delivery live in {@link OtpService}.
 */
public interface OtpLifecycleService {

    /**
     * Stores a new pending code.
     *
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpAlreadyActive if a live code exists
     */
    boolean issue(String identity, String hashedCode);

    /**
     * Checks a candidate against the live code, spending one attempt. A match consumes the code.
     *
     * @return {@code true} on match, {@code false} on mismatch
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpAttemptsExceeded if the budget is spent
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpVerificationFailed if no live code exists
     */
    boolean verify(String identity, String candidateCode);

    /**
     * Drops a pending code if there is one.
     *
     * @return {@code true} if a code was removed
     */
    boolean revoke(String identity);
}
