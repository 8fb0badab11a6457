package com.syncnest.accountservice.controller;

import com.syncnest.accountservice.dto.LoginRequest;
import com.syncnest.accountservice.dto.RegistrationRequest;
import com.syncnest.accountservice.dto.VerifyOTPRequest;
import com.syncnest.accountservice.service.AuthService;
import com.syncnest.accountservice.service.RegistrationService;
import com.syncnest.accountservice.utils.ResultResponses;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Registration and two-step login")
public class AuthController {

    private final RegistrationService registrationService;
    private final AuthService authService;
    private final ResultResponses responses;

    @PostMapping("/register")
    @Operation(summary = "Register an account and send a verification code")
    public ResponseEntity<Object> register(@Valid @RequestBody RegistrationRequest request, HttpServletRequest http) {
        return responses.toResponse(registrationService.register(request), HttpStatus.CREATED, http);
    }

    @PostMapping("/register/verify")
    @Operation(summary = "Confirm registration with the e-mailed code")
    public ResponseEntity<Object> verifyRegistration(@Valid @RequestBody VerifyOTPRequest request,
                                                     HttpServletRequest http) {
        return responses.toResponse(
                registrationService.confirmRegistration(request.getEmail(), request.getOtp()), HttpStatus.OK, http);
    }

    @PostMapping("/login")
    @Operation(summary = "Check credentials and send a login code")
    public ResponseEntity<Object> login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        return responses.toResponse(authService.login(request), HttpStatus.OK, http);
    }

    @PostMapping("/login/verify")
    @Operation(summary = "Confirm login with the e-mailed code and receive an access token")
    public ResponseEntity<Object> verifyLogin(@Valid @RequestBody VerifyOTPRequest request, HttpServletRequest http) {
        return responses.toResponse(
                authService.confirmLogin(request.getEmail(), request.getOtp()),
                HttpStatus.OK, http, authService::issueTokensFor);
    }
}
