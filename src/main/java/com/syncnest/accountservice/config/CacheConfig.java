package com.syncnest.accountservice.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.KeyGenerator;
import org.springframework.cache.interceptor.SimpleKeyGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Slf4j
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ACCOUNT_DETAILS_BY_EMAIL = "accountDetailsByEmail";

    /** Principal cache for the JWT filter. Only verified, active accounts are ever cached. */
    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager mgr = new CaffeineCacheManager();
        mgr.setCaffeine(
                Caffeine.newBuilder()
                        .maximumSize(10_000)
                        .expireAfterWrite(Duration.ofMinutes(5))
                        .recordStats()
        );
        mgr.setCacheNames(List.of(ACCOUNT_DETAILS_BY_EMAIL));
        mgr.setAllowNullValues(false);
        return mgr;
    }

    /** Trims and lower-cases single String keys so e-mail casing never splits entries. */
    @Bean
    public KeyGenerator lowerCaseStringKeyGenerator() {
        return (target, method, params) -> {
            if (params.length == 1 && params[0] instanceof String s) {
                return s.trim().toLowerCase(Locale.ROOT);
            }
            return SimpleKeyGenerator.generateKey(params);
        };
    }

    /** Cache faults degrade to a repository lookup instead of failing the request. */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(@NonNull RuntimeException exception,
                                            @NonNull Cache cache,
                                            @NonNull Object key) {
                log.warn("Cache GET error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCachePutError(@NonNull RuntimeException exception,
                                            @NonNull Cache cache,
                                            @NonNull Object key,
                                            @Nullable Object value) {
                log.warn("Cache PUT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheEvictError(@NonNull RuntimeException exception,
                                              @NonNull Cache cache,
                                              @NonNull Object key) {
                log.warn("Cache EVICT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheClearError(@NonNull RuntimeException exception,
                                              @NonNull Cache cache) {
                log.warn("Cache CLEAR error on {}: {}", cache.getName(), exception.toString());
            }
        };
    }
}
