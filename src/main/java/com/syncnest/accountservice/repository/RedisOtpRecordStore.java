package com.syncnest.accountservice.repository;

import com.syncnest.accountservice.config.OtpProperties;
import com.syncnest.accountservice.exception.OtpExceptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Redis hash per identity under {@code <prefix><identity>} with fields {@code hashed_code} and
 * {@code attempts}. Create and increment run as Lua scripts so that a record never exists
 * without a TTL and an expired record is never brought back by a late increment.
 */
@Slf4j
@Repository
public class RedisOtpRecordStore implements OtpRecordStore {

    static final String FIELD_CODE = "hashed_code";
    static final String FIELD_ATTEMPTS = "attempts";

    // KEYS[1]=record ARGV[1]=code field ARGV[2]=hash ARGV[3]=attempts field ARGV[4]=ttl seconds
    private static final RedisScript<Long> CREATE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 1 then\n" +
            "  return 0\n" +
            "end\n" +
            "redis.call('HSET', KEYS[1], ARGV[1], ARGV[2], ARGV[3], '0')\n" +
            "redis.call('EXPIRE', KEYS[1], tonumber(ARGV[4]))\n" +
            "return 1",
            Long.class);

    // KEYS[1]=record ARGV[1]=attempts field; -1 when the record is gone
    private static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 0 then\n" +
            "  return -1\n" +
            "end\n" +
            "return redis.call('HINCRBY', KEYS[1], ARGV[1], 1)",
            Long.class);

    private final StringRedisTemplate redis;
    private final OtpProperties props;

    public RedisOtpRecordStore(StringRedisTemplate redis, OtpProperties props) {
        this.redis = redis;
        this.props = props;
    }

    @Override
    public boolean setRecord(String identity, String hashedCode) {
        String key = props.key(identity);
        Long reply = redis.execute(CREATE_SCRIPT, List.of(key),
                FIELD_CODE, hashedCode, FIELD_ATTEMPTS, String.valueOf(props.ttlSeconds()));
        if (reply == null) {
            throw new OtpExceptions.OtpCreationFailed(key, null);
        }
        if (reply == 1L) {
            log.debug("OTP record created key={} ttl={}s", key, props.ttlSeconds());
            return true;
        }
        if (reply == 0L) {
            return false;
        }
        throw new OtpExceptions.OtpCreationFailed(key, reply);
    }

    @Override
    public String getCode(String identity) {
        HashOperations<String, String, String> ops = redis.opsForHash();
        String hashed = ops.get(props.key(identity), FIELD_CODE);
        if (hashed == null) {
            throw new OtpExceptions.OtpVerificationFailed(identity);
        }
        return hashed;
    }

    @Override
    public boolean deleteRecord(String identity) {
        String key = props.key(identity);
        Boolean removed = redis.unlink(key);
        if (!Boolean.TRUE.equals(removed)) {
            throw new OtpExceptions.OtpRemovalFailed(key);
        }
        return true;
    }

    @Override
    public boolean exists(String identity) {
        return Boolean.TRUE.equals(redis.hasKey(props.key(identity)));
    }

    @Override
    public long incrementAttempts(String identity) {
        String key = props.key(identity);
        Long value;
        try {
            value = redis.execute(INCREMENT_SCRIPT, List.of(key), FIELD_ATTEMPTS);
        } catch (RedisSystemException e) {
            throw new OtpExceptions.OtpAttemptTrackingFailed(key, e);
        }
        if (value == null) {
            throw new OtpExceptions.OtpAttemptTrackingFailed(key, null);
        }
        if (value < 0) {
            throw new OtpExceptions.OtpVerificationFailed(identity);
        }
        return value;
    }

    @Override
    public int getAttempts(String identity) {
        HashOperations<String, String, String> ops = redis.opsForHash();
        String raw = ops.get(props.key(identity), FIELD_ATTEMPTS);
        return raw == null ? -1 : Integer.parseInt(raw);
    }
}
