package com.syncnest.accountservice.repository;

import com.syncnest.accountservice.OtpTestSupport;
import com.syncnest.accountservice.exception.OtpExceptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisOtpRecordStoreTest {

    private static final String ID = "alice@example.com";
    private static final String KEY = "otp:users:alice@example.com";

    @Mock
    private StringRedisTemplate redis;
    @Mock
    private HashOperations<String, String, String> hashOps;

    private RedisOtpRecordStore store;

    @BeforeEach
    void setUp() {
        store = new RedisOtpRecordStore(redis, OtpTestSupport.props());
    }

    @Test
    @SuppressWarnings("unchecked")
    void setRecord_runsCreateScriptWithFieldsAndTtl() {
        when(redis.execute(any(RedisScript.class), anyList(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(1L);

        assertThat(store.setRecord(ID, "$2a$04$hash")).isTrue();

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(redis).execute(any(RedisScript.class), keys.capture(),
                eq("hashed_code"), eq("$2a$04$hash"), eq("attempts"), eq("300"));
        assertThat(keys.getValue()).containsExactly(KEY);
    }

    @Test
    @SuppressWarnings("unchecked")
    void setRecord_whenLiveRecordExists_returnsFalse() {
        when(redis.execute(any(RedisScript.class), anyList(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(0L);

        assertThat(store.setRecord(ID, "$2a$04$hash")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void setRecord_withoutReply_failsCreation() {
        when(redis.execute(any(RedisScript.class), anyList(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(null);

        assertThrows(OtpExceptions.OtpCreationFailed.class, () -> store.setRecord(ID, "$2a$04$hash"));
    }

    @Test
    void getCode_returnsStoredHash() {
        when(redis.<String, String>opsForHash()).thenReturn(hashOps);
        when(hashOps.get(KEY, "hashed_code")).thenReturn("$2a$04$hash");

        assertThat(store.getCode(ID)).isEqualTo("$2a$04$hash");
    }

    @Test
    void getCode_missing_failsVerification() {
        when(redis.<String, String>opsForHash()).thenReturn(hashOps);
        when(hashOps.get(KEY, "hashed_code")).thenReturn(null);

        assertThrows(OtpExceptions.OtpVerificationFailed.class, () -> store.getCode(ID));
    }

    @Test
    void deleteRecord_unlinksKey() {
        when(redis.unlink(KEY)).thenReturn(true);

        assertThat(store.deleteRecord(ID)).isTrue();
    }

    @Test
    void deleteRecord_nothingDeleted_failsRemoval() {
        when(redis.unlink(KEY)).thenReturn(false);

        assertThrows(OtpExceptions.OtpRemovalFailed.class, () -> store.deleteRecord(ID));
    }

    @Test
    void exists_probesNamespacedKey() {
        when(redis.hasKey(KEY)).thenReturn(true);
        when(redis.hasKey("otp:users:bob@example.com")).thenReturn(false);

        assertThat(store.exists(ID)).isTrue();
        assertThat(store.exists("bob@example.com")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void incrementAttempts_returnsNewValue() {
        when(redis.execute(any(RedisScript.class), eq(List.of(KEY)), eq("attempts"))).thenReturn(3L);

        assertThat(store.incrementAttempts(ID)).isEqualTo(3L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void incrementAttempts_onVanishedRecord_failsVerification() {
        when(redis.execute(any(RedisScript.class), eq(List.of(KEY)), eq("attempts"))).thenReturn(-1L);

        assertThrows(OtpExceptions.OtpVerificationFailed.class, () -> store.incrementAttempts(ID));
    }

    @Test
    @SuppressWarnings("unchecked")
    void incrementAttempts_rejectedByRedis_failsTracking() {
        when(redis.execute(any(RedisScript.class), eq(List.of(KEY)), eq("attempts")))
                .thenThrow(new RedisSystemException("WRONGTYPE", new IllegalStateException()));

        assertThrows(OtpExceptions.OtpAttemptTrackingFailed.class, () -> store.incrementAttempts(ID));
    }

    @Test
    void getAttempts_parsesCounterOrReturnsSentinel() {
        when(redis.<String, String>opsForHash()).thenReturn(hashOps);
        when(hashOps.get(KEY, "attempts")).thenReturn("2");
        when(hashOps.get("otp:users:bob@example.com", "attempts")).thenReturn(null);

        assertThat(store.getAttempts(ID)).isEqualTo(2);
        assertThat(store.getAttempts("bob@example.com")).isEqualTo(-1);
    }
}
