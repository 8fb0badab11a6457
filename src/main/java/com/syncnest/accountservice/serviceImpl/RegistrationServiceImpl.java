package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.dto.AccountSummary;
import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.dto.RegistrationRequest;
import com.syncnest.accountservice.entity.Account;
import com.syncnest.accountservice.entity.AccountRole;
import com.syncnest.accountservice.model.FailureKind;
import com.syncnest.accountservice.model.ServiceResult;
import com.syncnest.accountservice.repository.AccountRepository;
import com.syncnest.accountservice.service.OtpService;
import com.syncnest.accountservice.service.RegistrationService;
import com.syncnest.accountservice.utils.CpuBoundExecutor;
import com.syncnest.accountservice.utils.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationServiceImpl implements RegistrationService {

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final CpuBoundExecutor cpu;
    private final OtpService otpService;
    private final InputValidator inputValidator;

    @Override
    public ServiceResult<OtpDispatch> register(RegistrationRequest request) {
        Optional<String> invalid =
                inputValidator.firstViolation(request, request != null ? request.getEmail() : null);
        if (invalid.isPresent()) {
            return ServiceResult.failure(FailureKind.VALIDATION_ERROR, invalid.get());
        }
        final String email = InputValidator.normalizeEmail(request.getEmail());
        final String password = request.getPassword();

        Optional<Account> existing = accountRepository.findByEmail(email);
        if (existing.isPresent() && existing.get().isVerified()) {
            log.info("Registration rejected, {} is already verified", email);
            return ServiceResult.failure(FailureKind.DUPLICATE_ACCOUNT);
        }

        if (existing.isPresent()) {
            // pending registration keeps the credentials it was created with; only the code is replaced
            log.info("Registration restarted for unverified {}", email);
            return otpService.reissueCode(email);
        }

        final String passwordHash = cpu.call(() -> passwordEncoder.encode(password));
        Account account = Account.builder()
                .email(email)
                .passwordHash(passwordHash)
                .role(AccountRole.ROLE_USER)
                .active(true)
                .verified(false)
                .build();
        accountRepository.save(account);

        ServiceResult<OtpDispatch> sent = otpService.requestCode(email);
        if (!sent.isSuccess()) {
            // a failed register leaves no account behind
            accountRepository.delete(account);
            log.info("Account for {} discarded, code not issued", email);
            return sent;
        }
        log.info("Account created for {}", email);
        return sent;
    }

    @Override
    public ServiceResult<AccountSummary> confirmRegistration(String rawEmail, String code) {
        Optional<String> invalid = inputValidator.checkEmail(rawEmail);
        if (invalid.isPresent()) {
            return ServiceResult.failure(FailureKind.VALIDATION_ERROR, invalid.get());
        }
        final String email = InputValidator.normalizeEmail(rawEmail);

        Optional<Account> found = accountRepository.findByEmail(email);
        if (found.isEmpty()) {
            return ServiceResult.failure(FailureKind.OTP_VERIFICATION_FAILED);
        }
        if (found.get().isVerified()) {
            return ServiceResult.failure(FailureKind.ALREADY_VERIFIED);
        }

        return otpService.confirmCode(email, code).flatMap(ignored -> {
            if (accountRepository.markVerified(email) == 0) {
                log.info("Account {} was verified concurrently", email);
                return ServiceResult.failure(FailureKind.ALREADY_VERIFIED);
            }
            Account account = found.get();
            account.setVerified(true);
            log.info("Account verified: {}", email);
            return ServiceResult.success("Account verified successfully", AccountSummary.of(account));
        });
    }
}
