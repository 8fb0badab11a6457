package com.syncnest.accountservice.service;

import com.syncnest.accountservice.dto.LoginRequest;
import com.syncnest.accountservice.dto.LoginResponse;
import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.entity.Account;
import com.syncnest.accountservice.model.ServiceResult;

public interface AuthService {

    /** Checks credentials of a verified account and sends it a login code. */
    ServiceResult<OtpDispatch> login(LoginRequest request);

    /** Verifies the login code; the account is returned for token issuance. */
    ServiceResult<Account> confirmLogin(String email, String code);

    LoginResponse issueTokensFor(Account account);
}
