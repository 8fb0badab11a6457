package com.syncnest.accountservice.service;

/**
 * Hands a plaintext code to the user. Fire-and-forget: implementations must not block the
 * caller on delivery and must not report delivery failures back to it.
 */
public interface OtpDeliveryChannel {

    void dispatch(String destination, String code);
}
