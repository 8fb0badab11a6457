package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.config.OtpProperties;
import com.syncnest.accountservice.exception.OtpExceptions;
import com.syncnest.accountservice.repository.OtpRecordStore;
import com.syncnest.accountservice.service.OtpLifecycleService;
import com.syncnest.accountservice.utils.CpuBoundExecutor;
import com.syncnest.accountservice.utils.OtpHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OtpLifecycleServiceImpl implements OtpLifecycleService {

    private final OtpRecordStore store;
    private final OtpHasher hasher;
    private final CpuBoundExecutor cpu;
    private final OtpProperties props;

    @Override
    public boolean issue(String identity, String hashedCode) {
        if (store.exists(identity)) {
            throw new OtpExceptions.OtpAlreadyActive(identity);
        }
        // a concurrent issue may have won between the probe and the write
        if (!store.setRecord(identity, hashedCode)) {
            throw new OtpExceptions.OtpAlreadyActive(identity);
        }
        log.debug("OTP pending for {}", identity);
        return true;
    }

    @Override
    public boolean verify(String identity, String candidateCode) {
        final int max = props.maxVerifyAttempts();

        int attempts = store.getAttempts(identity);
        if (attempts >= max) {
            log.info("OTP attempts exhausted for {} (attempts={})", identity, attempts);
            throw new OtpExceptions.OtpAttemptsExceeded(identity, attempts);
        }

        String storedHash = store.getCode(identity);

        long spent = store.incrementAttempts(identity);
        if (spent > max) {
            // lost a race against concurrent verifications of the same code
            log.info("OTP attempts exhausted for {} (attempts={})", identity, spent);
            throw new OtpExceptions.OtpAttemptsExceeded(identity, spent);
        }

        boolean matched = cpu.call(() -> hasher.matches(candidateCode, storedHash));
        if (!matched) {
            log.debug("OTP mismatch for {} (attempts={}/{})", identity, spent, max);
            return false;
        }

        try {
            store.deleteRecord(identity);
        } catch (OtpExceptions.OtpRemovalFailed e) {
            // a concurrent verification consumed the same code first
            log.info("OTP for {} already consumed", identity);
            throw new OtpExceptions.OtpVerificationFailed(identity);
        }
        log.info("OTP consumed for {}", identity);
        return true;
    }

    @Override
    public boolean revoke(String identity) {
        if (!store.exists(identity)) {
            return false;
        }
        try {
            store.deleteRecord(identity);
        } catch (OtpExceptions.OtpRemovalFailed e) {
            // expired or consumed between the probe and the delete
            log.debug("OTP for {} gone before revoke", identity);
            return false;
        }
        log.debug("OTP revoked for {}", identity);
        return true;
    }
}
