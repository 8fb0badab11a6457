package com.syncnest.accountservice.dto;

/** Returned once a code has been stored and handed to delivery. */
public record OtpDispatch(String email, long expiresInSeconds) {
}
