package com.syncnest.accountservice.repository;

/**
 * Persistence port for one-time-password records. One record per identity, holding the
 * hashed code and an attempt counter, expiring on its own after the configured TTL.
 * <p>
 * Every method may also throw {@link org.springframework.dao.DataAccessException} when the
 * store is unreachable; callers treat that as fatal.
 */
public interface OtpRecordStore {

    /**
     * Atomically creates the record with {@code attempts = 0} and the configured TTL.
     *
     * @return {@code false} if a live record already exists; nothing is written then
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpCreationFailed if the write did not apply
     */
    boolean setRecord(String identity, String hashedCode);

    /**
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpVerificationFailed if no live record exists
     */
    String getCode(String identity);

    /**
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpRemovalFailed if nothing was deleted
     */
    boolean deleteRecord(String identity);

    boolean exists(String identity);

    /**
     * Atomically adds one to the counter of a live record.
     *
     * @return the counter value after the increment
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpVerificationFailed if the record is gone
     * @throws com.syncnest.accountservice.exception.OtpExceptions.OtpAttemptTrackingFailed if the store rejected the update
     */
    long incrementAttempts(String identity);

    /** @return the counter, or {@code -1} if no record exists */
    int getAttempts(String identity);
}
