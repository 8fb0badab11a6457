package com.syncnest.accountservice.config;

import dev.samstevens.totp.time.SystemTimeProvider;
import dev.samstevens.totp.time.TimeProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OtpConfig {

    @Bean
    public TimeProvider otpTimeProvider() {
        return new SystemTimeProvider();
    }
}
