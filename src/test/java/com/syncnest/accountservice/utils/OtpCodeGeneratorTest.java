package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.config.OtpProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OtpCodeGeneratorTest {

    @Test
    void generate_producesConfiguredNumberOfDigits() {
        OtpCodeGenerator six = new OtpCodeGenerator(
                new OtpProperties(300, 6, 5, "otp:users:", 4), () -> 1_700_000_000L);
        OtpCodeGenerator eight = new OtpCodeGenerator(
                new OtpProperties(300, 8, 5, "otp:users:", 4), () -> 1_700_000_000L);

        for (int i = 0; i < 20; i++) {
            assertThat(six.generate()).matches("\\d{6}");
            assertThat(eight.generate()).matches("\\d{8}");
        }
    }
}
