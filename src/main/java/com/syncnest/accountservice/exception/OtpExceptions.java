package com.syncnest.accountservice.exception;

import com.syncnest.accountservice.model.FailureKind;

/**
 * One-time-password lifecycle failures.
 *
 * <ul>
 *   <li>business rules: already active, expired or never created, attempt budget spent</li>
 *   <li>operational: the store refused a create, delete or counter update</li>
 * </ul>
 * Operational details are kept in the exception message for logs; clients only see the
 * kind's default message.
 */
public final class OtpExceptions {

    private OtpExceptions() {}

    /** 409 Conflict – a live code already exists for the identity. */
    public static final class OtpAlreadyActive extends ApiException {
        public OtpAlreadyActive(String identity) {
            super(FailureKind.OTP_ALREADY_ACTIVE, "Active otp exists for " + identity);
        }
    }

    /** 400 Bad Request – no live code: never requested, expired, or already consumed. */
    public static final class OtpVerificationFailed extends ApiException {
        public OtpVerificationFailed(String identity) {
            super(FailureKind.OTP_VERIFICATION_FAILED, "No live otp for " + identity);
        }
    }

    /** 429 Too Many Requests – verification budget for the live code is spent. */
    public static final class OtpAttemptsExceeded extends ApiException {
        public OtpAttemptsExceeded(String identity, long attempts) {
            super(FailureKind.OTP_ATTEMPTS_EXCEEDED,
                    "Otp attempts exhausted for " + identity + " (attempts=" + attempts + ")");
        }
    }

    public static final class OtpCreationFailed extends ApiException {
        public OtpCreationFailed(String key, Object reply) {
            super(FailureKind.INTERNAL_ERROR, "Otp create script returned " + reply + " for " + key);
        }
    }

    public static final class OtpRemovalFailed extends ApiException {
        public OtpRemovalFailed(String key) {
            super(FailureKind.INTERNAL_ERROR, "Otp record not removed for " + key);
        }
    }

    public static final class OtpAttemptTrackingFailed extends ApiException {
        public OtpAttemptTrackingFailed(String key, Throwable cause) {
            super(FailureKind.INTERNAL_ERROR, "Attempt counter update rejected for " + key, cause);
        }
    }
}
