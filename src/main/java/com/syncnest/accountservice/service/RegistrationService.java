package com.syncnest.accountservice.service;

import com.syncnest.accountservice.dto.AccountSummary;
import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.dto.RegistrationRequest;
import com.syncnest.accountservice.model.ServiceResult;

public interface RegistrationService {

    /** Creates (or refreshes a pending) unverified account and sends it a registration code. */
    ServiceResult<OtpDispatch> register(RegistrationRequest request);

    /** Verifies the registration code and marks the account verified. */
    ServiceResult<AccountSummary> confirmRegistration(String email, String code);
}
