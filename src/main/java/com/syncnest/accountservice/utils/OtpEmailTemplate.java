package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.config.OtpMailProperties;
import com.syncnest.accountservice.config.OtpProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Renders the plain-text and HTML bodies of the code e-mail. The HTML template is read once
 * from the classpath; placeholders are {@code {{otp}}} and {@code {{otp_expiration_time}}} (minutes).
 */
@Component
public class OtpEmailTemplate {

    private final String htmlTemplate;
    private final long expiryMinutes;

    public OtpEmailTemplate(OtpMailProperties mailProps, OtpProperties otpProps) {
        this.htmlTemplate = load(mailProps.template());
        this.expiryMinutes = Math.max(1, Math.round(otpProps.ttlSeconds() / 60.0));
    }

    public String text(String code) {
        return "Your verification code is " + code + ". It expires in " + expiryMinutes + " minutes.";
    }

    public String html(String code) {
        return htmlTemplate
                .replace("{{otp}}", code)
                .replace("{{otp_expiration_time}}", String.valueOf(expiryMinutes));
    }

    private static String load(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read mail template " + path, e);
        }
    }
}
