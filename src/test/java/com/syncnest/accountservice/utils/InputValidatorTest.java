package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.dto.RegistrationRequest;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class InputValidatorTest {

    private final InputValidator validator =
            new InputValidator(Validation.buildDefaultValidatorFactory().getValidator());

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "plain", "a@", "@example.com"})
    void checkEmail_rejectsMalformedAddresses(String email) {
        assertThat(validator.checkEmail(email)).contains("Invalid email format");
    }

    @Test
    void checkEmail_acceptsPaddedAddress() {
        assertThat(validator.checkEmail("  alice@example.com ")).isEmpty();
        assertThat(validator.checkEmail(null)).contains("Invalid email format");
    }

    @Test
    void checkCode_reportsDigitsBeforeLength() {
        assertThat(validator.checkCode("12a", 6)).contains("Otp must contain only digits");
        assertThat(validator.checkCode("", 6)).contains("Otp must contain only digits");
        assertThat(validator.checkCode("12345", 6)).contains("Otp must be 6 digits long");
        assertThat(validator.checkCode("1234567", 6)).contains("Otp must be 6 digits long");
        assertThat(validator.checkCode("012345", 6)).isEmpty();
    }

    @Test
    void firstViolation_isStableAcrossFields() {
        RegistrationRequest bad = RegistrationRequest.builder().email("nope").password("short").build();

        assertThat(validator.firstViolation(bad, bad.getEmail())).contains("Invalid email format");
        assertThat(validator.firstViolation(null, null)).contains("Request body is required");
    }

    @Test
    void firstViolation_judgesEmailLikeCheckEmail() {
        RegistrationRequest padded = RegistrationRequest.builder()
                .email("  alice@example.com ").password("s3cret-pass").build();
        RegistrationRequest paddedShortPassword = RegistrationRequest.builder()
                .email("  alice@example.com ").password("short").build();

        assertThat(validator.checkEmail(padded.getEmail())).isEmpty();
        assertThat(validator.firstViolation(padded, padded.getEmail())).isEmpty();
        assertThat(validator.firstViolation(paddedShortPassword, paddedShortPassword.getEmail()))
                .contains("Password length must be between 8 and 72");
    }

    @Test
    void normalizeEmail_trimsAndLowercases() {
        assertThat(InputValidator.normalizeEmail("  Alice@Example.COM ")).isEqualTo("alice@example.com");
    }
}
