package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.dto.OtpRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Bean Validation entry point for service-level checks. The same DTO constraints that guard
 * the HTTP layer are applied again before any store access.
 */
@Component
@RequiredArgsConstructor
public class InputValidator {

    public static final String INVALID_EMAIL = "Invalid email format";
    private static final String EMAIL_PROPERTY = "email";

    private final Validator validator;

    /**
     * First violation message of {@code bean}, ordered by property path. The bean's
     * {@code email} property is judged by {@link #checkEmail}, so a padded address passes
     * here exactly as it does on the code endpoints.
     */
    public Optional<String> firstViolation(Object bean, String email) {
        if (bean == null) {
            return Optional.of("Request body is required");
        }
        return checkEmail(email).or(() -> validator.validate(bean).stream()
                .filter(v -> !EMAIL_PROPERTY.equals(v.getPropertyPath().toString()))
                .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage));
    }

    /** @return an error message when {@code email} is not a syntactically valid address */
    public Optional<String> checkEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.of(INVALID_EMAIL);
        }
        boolean invalid = !validator.validateValue(OtpRequest.class, EMAIL_PROPERTY, email.trim()).isEmpty();
        return invalid ? Optional.of(INVALID_EMAIL) : Optional.empty();
    }

    /** @return an error message unless {@code code} is exactly {@code digits} decimal digits */
    public Optional<String> checkCode(String code, int digits) {
        if (code == null || code.isEmpty() || !code.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return Optional.of("Otp must contain only digits");
        }
        if (code.length() != digits) {
            return Optional.of("Otp must be " + digits + " digits long");
        }
        return Optional.empty();
    }

    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
