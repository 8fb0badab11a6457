package com.syncnest.accountservice.controller;

import com.syncnest.accountservice.config.OpenApiConfig;
import com.syncnest.accountservice.dto.AccountSummary;
import com.syncnest.accountservice.entity.Account;
import com.syncnest.accountservice.model.ApiResponse;
import com.syncnest.accountservice.utils.ErrorResponseWriter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/account")
@RequiredArgsConstructor
@Tag(name = "Account")
public class AccountController {

    private final ErrorResponseWriter errorWriter;

    @GetMapping("/me")
    @Operation(summary = "Current account", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public ResponseEntity<ApiResponse<AccountSummary>> me(@AuthenticationPrincipal Account account,
                                                          HttpServletRequest http) {
        return ResponseEntity.ok(ApiResponse.of(
                errorWriter.resolveRequestId(http, null), "Account details", AccountSummary.of(account)));
    }
}
