package com.syncnest.accountservice.controller;

import com.syncnest.accountservice.dto.OtpRequest;
import com.syncnest.accountservice.dto.VerifyOTPRequest;
import com.syncnest.accountservice.service.OtpService;
import com.syncnest.accountservice.utils.ResultResponses;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/otp")
@RequiredArgsConstructor
@Tag(name = "OTP", description = "Stand-alone one-time codes")
public class OtpController {

    private final OtpService otpService;
    private final ResultResponses responses;

    @PostMapping("/send")
    @Operation(summary = "Send a one-time code to an e-mail address")
    public ResponseEntity<Object> send(@Valid @RequestBody OtpRequest request, HttpServletRequest http) {
        return responses.toResponse(otpService.requestCode(request.getEmail()), HttpStatus.CREATED, http);
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify a one-time code")
    public ResponseEntity<Object> verify(@Valid @RequestBody VerifyOTPRequest request, HttpServletRequest http) {
        return responses.toResponse(otpService.confirmCode(request.getEmail(), request.getOtp()), HttpStatus.OK, http);
    }
}
