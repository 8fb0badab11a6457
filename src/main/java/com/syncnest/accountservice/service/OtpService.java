package com.syncnest.accountservice.service;

import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.model.ServiceResult;

public interface OtpService {

    String CODE_SENT = "Otp sent successfully";
    String CODE_VERIFIED = "Otp verified successfully";

    /** Generates, stores and dispatches a new code for {@code email}. */
    ServiceResult<OtpDispatch> requestCode(String email);

    /** Drops any pending code for {@code email}, then behaves like {@link #requestCode}. */
    ServiceResult<OtpDispatch> reissueCode(String email);

    /** Checks {@code code} against the pending code for {@code email}. */
    ServiceResult<Void> confirmCode(String email, String code);
}
