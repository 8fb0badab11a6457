package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.config.OtpProperties;
import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.exception.ApiException;
import com.syncnest.accountservice.model.FailureKind;
import com.syncnest.accountservice.model.ServiceResult;
import com.syncnest.accountservice.service.OtpDeliveryChannel;
import com.syncnest.accountservice.service.OtpLifecycleService;
import com.syncnest.accountservice.service.OtpService;
import com.syncnest.accountservice.utils.CpuBoundExecutor;
import com.syncnest.accountservice.utils.InputValidator;
import com.syncnest.accountservice.utils.OtpCodeGenerator;
import com.syncnest.accountservice.utils.OtpHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OtpServiceImpl implements OtpService {

    private final OtpLifecycleService lifecycle;
    private final OtpCodeGenerator codeGenerator;
    private final OtpHasher hasher;
    private final CpuBoundExecutor cpu;
    private final OtpDeliveryChannel delivery;
    private final InputValidator inputValidator;
    private final OtpProperties props;

    @Override
    public ServiceResult<OtpDispatch> requestCode(String rawEmail) {
        Optional<String> invalid = inputValidator.checkEmail(rawEmail);
        if (invalid.isPresent()) {
            return ServiceResult.failure(FailureKind.VALIDATION_ERROR, invalid.get());
        }
        return issueAndDispatch(InputValidator.normalizeEmail(rawEmail));
    }

    @Override
    public ServiceResult<OtpDispatch> reissueCode(String rawEmail) {
        Optional<String> invalid = inputValidator.checkEmail(rawEmail);
        if (invalid.isPresent()) {
            return ServiceResult.failure(FailureKind.VALIDATION_ERROR, invalid.get());
        }
        final String email = InputValidator.normalizeEmail(rawEmail);
        try {
            lifecycle.revoke(email);
        } catch (ApiException ex) {
            return toFailure(email, ex);
        }
        return issueAndDispatch(email);
    }

    @Override
    public ServiceResult<Void> confirmCode(String rawEmail, String code) {
        Optional<String> invalid = inputValidator.checkEmail(rawEmail)
                .or(() -> inputValidator.checkCode(code, props.digits()));
        if (invalid.isPresent()) {
            return ServiceResult.failure(FailureKind.VALIDATION_ERROR, invalid.get());
        }
        final String email = InputValidator.normalizeEmail(rawEmail);

        final boolean matched;
        try {
            matched = lifecycle.verify(email, code);
        } catch (ApiException ex) {
            return toFailure(email, ex);
        }
        return matched
                ? ServiceResult.success(CODE_VERIFIED, null)
                : ServiceResult.failure(FailureKind.OTP_INCORRECT);
    }

    private ServiceResult<OtpDispatch> issueAndDispatch(String email) {
        final String code = codeGenerator.generate();
        final String hashed = cpu.call(() -> hasher.hash(code));
        try {
            lifecycle.issue(email, hashed);
        } catch (ApiException ex) {
            return toFailure(email, ex);
        }

        delivery.dispatch(email, code);
        log.info("OTP issued for {}", email);
        return ServiceResult.success(CODE_SENT, new OtpDispatch(email, props.ttlSeconds()));
    }

    private <T> ServiceResult<T> toFailure(String email, ApiException ex) {
        if (ex.isOperational()) {
            log.error("OTP store failure for {}: {}", email, ex.getMessage(), ex);
            return ServiceResult.failure(FailureKind.INTERNAL_ERROR);
        }
        log.debug("OTP request for {} rejected: {}", email, ex.code());
        return ServiceResult.failure(ex.getKind());
    }
}
