package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.OtpTestSupport;
import com.syncnest.accountservice.dto.OtpDispatch;
import com.syncnest.accountservice.exception.OtpExceptions;
import com.syncnest.accountservice.model.FailureKind;
import com.syncnest.accountservice.model.ServiceResult;
import com.syncnest.accountservice.repository.InMemoryOtpRecordStore;
import com.syncnest.accountservice.service.OtpDeliveryChannel;
import com.syncnest.accountservice.service.OtpLifecycleService;
import com.syncnest.accountservice.utils.InputValidator;
import com.syncnest.accountservice.utils.OtpCodeGenerator;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OtpServiceImplTest {

    private static final String EMAIL = "alice@example.com";

    private static Validator validator;

    private InMemoryOtpRecordStore store;
    private OtpCodeGenerator codeGenerator;
    private OtpDeliveryChannel delivery;
    private OtpServiceImpl service;

    @BeforeAll
    static void initValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryOtpRecordStore(Duration.ofSeconds(OtpTestSupport.TTL_SECONDS));
        codeGenerator = mock(OtpCodeGenerator.class);
        when(codeGenerator.generate()).thenReturn("123456");
        delivery = mock(OtpDeliveryChannel.class);
        service = newService(new OtpLifecycleServiceImpl(
                store, OtpTestSupport.hasher(), OtpTestSupport.directCpu(), OtpTestSupport.props()));
    }

    private OtpServiceImpl newService(OtpLifecycleService lifecycle) {
        return new OtpServiceImpl(lifecycle, codeGenerator, OtpTestSupport.hasher(), OtpTestSupport.directCpu(),
                delivery, new InputValidator(validator), OtpTestSupport.props());
    }

    private static FailureKind kindOf(ServiceResult<?> result) {
        assertThat(result).isInstanceOf(ServiceResult.Failure.class);
        return ((ServiceResult.Failure<?>) result).kind();
    }

    @Test
    void requestThenConfirm_happyPath() {
        ServiceResult<OtpDispatch> sent = service.requestCode(EMAIL);

        assertThat(sent).isEqualTo(ServiceResult.success("Otp sent successfully", new OtpDispatch(EMAIL, 300)));
        verify(delivery).dispatch(EMAIL, "123456");
        assertThat(store.rawHash(EMAIL)).isNotEqualTo("123456");

        ServiceResult<Void> confirmed = service.confirmCode(EMAIL, "123456");

        assertThat(confirmed).isEqualTo(ServiceResult.success("Otp verified successfully", null));
        assertThat(store.exists(EMAIL)).isFalse();
    }

    @Test
    void bruteForce_isCutOffAfterFiveAttempts() {
        service.requestCode(EMAIL);

        for (int i = 0; i < 5; i++) {
            ServiceResult<Void> r = service.confirmCode(EMAIL, String.format("%06d", i));
            assertThat(kindOf(r)).isEqualTo(FailureKind.OTP_INCORRECT);
            assertThat(((ServiceResult.Failure<Void>) r).message()).isEqualTo("Incorrect OTP");
        }

        ServiceResult<Void> sixth = service.confirmCode(EMAIL, "123456");
        assertThat(kindOf(sixth)).isEqualTo(FailureKind.OTP_ATTEMPTS_EXCEEDED);
        assertThat(FailureKind.OTP_ATTEMPTS_EXCEEDED.getStatus().value()).isEqualTo(429);
        assertThat(((ServiceResult.Failure<Void>) sixth).message()).isEqualTo("Too many requests for verifying otp");
    }

    @Test
    void expiredCode_reportsVerificationFailed() {
        service.requestCode(EMAIL);
        store.advance(Duration.ofSeconds(301));

        ServiceResult<Void> r = service.confirmCode(EMAIL, "123456");

        assertThat(kindOf(r)).isEqualTo(FailureKind.OTP_VERIFICATION_FAILED);
        assertThat(((ServiceResult.Failure<Void>) r).message())
                .isEqualTo("Otp verification failed. Expired or not created");
    }

    @Test
    void secondRequestWhileActive_isRejectedWithoutSecondDispatch() {
        service.requestCode(EMAIL);

        ServiceResult<OtpDispatch> again = service.requestCode(EMAIL);

        assertThat(kindOf(again)).isEqualTo(FailureKind.OTP_ALREADY_ACTIVE);
        verify(delivery, times(1)).dispatch(anyString(), anyString());
    }

    @Test
    void email_isNormalizedBeforeUseAsKey() {
        service.requestCode("  Alice@Example.COM ");

        assertThat(store.exists(EMAIL)).isTrue();
        assertThat(service.confirmCode("ALICE@example.com", "123456").isSuccess()).isTrue();
    }

    @Test
    void invalidInput_isRejectedBeforeTouchingTheStore() {
        OtpLifecycleService lifecycle = mock(OtpLifecycleService.class);
        OtpServiceImpl guarded = newService(lifecycle);

        ServiceResult<OtpDispatch> badEmail = guarded.requestCode("not-an-email");
        ServiceResult<Void> letters = guarded.confirmCode(EMAIL, "12ab56");
        ServiceResult<Void> shortCode = guarded.confirmCode(EMAIL, "12345");
        ServiceResult<Void> badEmailOnConfirm = guarded.confirmCode("nope", "123456");

        assertThat(badEmail).isEqualTo(ServiceResult.failure(FailureKind.VALIDATION_ERROR, "Invalid email format"));
        assertThat(letters).isEqualTo(ServiceResult.failure(FailureKind.VALIDATION_ERROR, "Otp must contain only digits"));
        assertThat(shortCode).isEqualTo(ServiceResult.failure(FailureKind.VALIDATION_ERROR, "Otp must be 6 digits long"));
        assertThat(kindOf(badEmailOnConfirm)).isEqualTo(FailureKind.VALIDATION_ERROR);
        verifyNoInteractions(lifecycle, delivery);
    }

    @Test
    void storeFailure_becomesOpaqueInternalError() {
        OtpLifecycleService lifecycle = mock(OtpLifecycleService.class);
        when(lifecycle.issue(anyString(), anyString()))
                .thenThrow(new OtpExceptions.OtpCreationFailed("otp:users:" + EMAIL, 7L));

        ServiceResult<OtpDispatch> r = newService(lifecycle).requestCode(EMAIL);

        assertThat(r).isEqualTo(ServiceResult.failure(FailureKind.INTERNAL_ERROR));
        verify(delivery, never()).dispatch(anyString(), anyString());
    }

    @Test
    void reissue_replacesPendingCode() {
        when(codeGenerator.generate()).thenReturn("111111", "222222");
        service.requestCode(EMAIL);

        ServiceResult<OtpDispatch> reissued = service.reissueCode(EMAIL);

        assertThat(reissued.isSuccess()).isTrue();
        assertThat(kindOf(service.confirmCode(EMAIL, "111111"))).isEqualTo(FailureKind.OTP_INCORRECT);
        assertThat(service.confirmCode(EMAIL, "222222").isSuccess()).isTrue();
    }
}
