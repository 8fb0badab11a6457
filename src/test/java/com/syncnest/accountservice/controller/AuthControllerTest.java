package com.syncnest.accountservice.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncnest.accountservice.dto.AccountSummary;
import com.syncnest.accountservice.dto.LoginRequest;
import com.syncnest.accountservice.dto.LoginResponse;
import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.dto.RegistrationRequest;
import com.syncnest.accountservice.entity.Account;
import com.syncnest.accountservice.exception.GlobalExceptionHandler;
import com.syncnest.accountservice.model.FailureKind;
import com.syncnest.accountservice.model.ServiceResult;
import com.syncnest.accountservice.service.AuthService;
import com.syncnest.accountservice.service.OtpService;
import com.syncnest.accountservice.service.RegistrationService;
import com.syncnest.accountservice.utils.ErrorResponseWriter;
import com.syncnest.accountservice.utils.ResultResponses;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    private static final String EMAIL = "alice@example.com";
    private static final String VERIFY_BODY = "{\"email\":\"alice@example.com\",\"otp\":\"123456\"}";

    @Mock
    private RegistrationService registrationService;
    @Mock
    private AuthService authService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ErrorResponseWriter writer = new ErrorResponseWriter(new ObjectMapper().findAndRegisterModules());
        mvc = MockMvcBuilders
                .standaloneSetup(new AuthController(registrationService, authService, new ResultResponses(writer)))
                .setControllerAdvice(new GlobalExceptionHandler(writer))
                .build();
    }

    @Test
    void register_returnsCreated_andNeverEchoesPassword() throws Exception {
        when(registrationService.register(any(RegistrationRequest.class)))
                .thenReturn(ServiceResult.success(OtpService.CODE_SENT, new OtpDispatch(EMAIL, 300)));

        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"s3cret-pass\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.email").value(EMAIL))
                .andExpect(jsonPath("$.data.password").doesNotExist());
    }

    @Test
    void register_shortPassword_isValidationError() throws Exception {
        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"short\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").value("Password length must be between 8 and 72"));

        verifyNoInteractions(registrationService);
    }

    @Test
    void register_existingAccount_isConflict() throws Exception {
        when(registrationService.register(any(RegistrationRequest.class)))
                .thenReturn(ServiceResult.failure(FailureKind.DUPLICATE_ACCOUNT));

        mvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"s3cret-pass\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail").value("Email is already registered"));
    }

    @Test
    void verifyRegistration_returnsAccountSummary() throws Exception {
        AccountSummary summary = AccountSummary.builder()
                .email(EMAIL).roles(Set.of("ROLE_USER")).emailVerified(true).build();
        when(registrationService.confirmRegistration(EMAIL, "123456"))
                .thenReturn(ServiceResult.success("Account verified successfully", summary));

        mvc.perform(post("/auth/register/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VERIFY_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.emailVerified").value(true));
    }

    @Test
    void login_badCredentials_isUnauthorized() throws Exception {
        when(authService.login(any(LoginRequest.class)))
                .thenReturn(ServiceResult.failure(FailureKind.INVALID_CREDENTIALS));

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"wrong-pass\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));
    }

    @Test
    void verifyLogin_success_issuesToken() throws Exception {
        Account account = Account.builder().email(EMAIL).passwordHash("$x").active(true).verified(true).build();
        when(authService.confirmLogin(EMAIL, "123456")).thenReturn(ServiceResult.success("Login successful", account));
        when(authService.issueTokensFor(account)).thenReturn(LoginResponse.builder()
                .accessToken("token-value")
                .expiresIn(900)
                .issuedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .user(AccountSummary.of(account))
                .build());

        mvc.perform(post("/auth/login/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VERIFY_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Login successful"))
                .andExpect(jsonPath("$.data.accessToken").value("token-value"))
                .andExpect(jsonPath("$.data.tokenType").value("Bearer"));
    }

    @Test
    void verifyLogin_wrongCode_issuesNoToken() throws Exception {
        when(authService.confirmLogin(EMAIL, "123456"))
                .thenReturn(ServiceResult.failure(FailureKind.OTP_INCORRECT));

        mvc.perform(post("/auth/login/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VERIFY_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Incorrect OTP"));

        verify(authService, never()).issueTokensFor(any());
    }
}
