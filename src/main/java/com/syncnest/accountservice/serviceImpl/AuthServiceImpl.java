package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.SecurityConfig.JwtTokenProvider;
import com.syncnest.accountservice.dto.AccountSummary;
import com.syncnest.accountservice.dto.LoginRequest;
import com.syncnest.accountservice.dto.LoginResponse;
import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.entity.Account;
import com.syncnest.accountservice.model.FailureKind;
import com.syncnest.accountservice.model.ServiceResult;
import com.syncnest.accountservice.repository.AccountRepository;
import com.syncnest.accountservice.service.AuthService;
import com.syncnest.accountservice.service.OtpService;
import com.syncnest.accountservice.utils.CpuBoundExecutor;
import com.syncnest.accountservice.utils.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class AuthServiceImpl implements AuthService {

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final CpuBoundExecutor cpu;
    private final OtpService otpService;
    private final InputValidator inputValidator;
    private final JwtTokenProvider jwtTokenProvider;

    private final Clock clock = Clock.systemUTC();

    /** Compared against when no account matches, so both failure paths cost one bcrypt check. */
    private final String dummyHash;

    public AuthServiceImpl(AccountRepository accountRepository,
                           PasswordEncoder passwordEncoder,
                           CpuBoundExecutor cpu,
                           OtpService otpService,
                           InputValidator inputValidator,
                           JwtTokenProvider jwtTokenProvider) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.cpu = cpu;
        this.otpService = otpService;
        this.inputValidator = inputValidator;
        this.jwtTokenProvider = jwtTokenProvider;
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    @Override
    public ServiceResult<OtpDispatch> login(LoginRequest request) {
        Optional<String> invalid =
                inputValidator.firstViolation(request, request != null ? request.getEmail() : null);
        if (invalid.isPresent()) {
            return ServiceResult.failure(FailureKind.VALIDATION_ERROR, invalid.get());
        }
        final String email = InputValidator.normalizeEmail(request.getEmail());
        final String password = request.getPassword();

        Optional<Account> account = accountRepository.findByEmailAndActiveTrueAndVerifiedTrue(email);
        final String hash = account.map(Account::getPasswordHash).orElse(dummyHash);
        boolean matched = cpu.call(() -> passwordEncoder.matches(password, hash));

        if (account.isEmpty() || !matched) {
            log.info("Login rejected for {}", email);
            return ServiceResult.failure(FailureKind.INVALID_CREDENTIALS);
        }
        return otpService.requestCode(email);
    }

    @Override
    public ServiceResult<Account> confirmLogin(String rawEmail, String code) {
        Optional<String> invalid = inputValidator.checkEmail(rawEmail);
        if (invalid.isPresent()) {
            return ServiceResult.failure(FailureKind.VALIDATION_ERROR, invalid.get());
        }
        final String email = InputValidator.normalizeEmail(rawEmail);

        // never let the login path consume a pending registration code
        Optional<Account> account = accountRepository.findByEmailAndActiveTrueAndVerifiedTrue(email);
        if (account.isEmpty()) {
            return ServiceResult.failure(FailureKind.OTP_VERIFICATION_FAILED);
        }

        return otpService.confirmCode(email, code).flatMap(ignored -> {
            log.info("Login success for {}", email);
            return ServiceResult.success("Login successful", account.get());
        });
    }

    @Override
    public LoginResponse issueTokensFor(Account account) {
        Objects.requireNonNull(account, "account is required");
        return LoginResponse.builder()
                .accessToken(jwtTokenProvider.generateToken(account.getEmail()))
                .expiresIn(jwtTokenProvider.getTokenValiditySeconds())
                .issuedAt(Instant.now(clock))
                .user(AccountSummary.of(account))
                .build();
    }
}
