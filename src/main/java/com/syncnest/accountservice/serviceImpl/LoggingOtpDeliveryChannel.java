package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.config.OtpProperties;
import com.syncnest.accountservice.service.OtpDeliveryChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Local-development channel: writes the code to the log instead of sending mail.
 * Active only with {@code app.mail.enabled=false}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.mail", name = "enabled", havingValue = "false")
public class LoggingOtpDeliveryChannel implements OtpDeliveryChannel {

    private final OtpProperties props;

    @Override
    public void dispatch(String destination, String code) {
        log.warn("Mail delivery disabled; otp for {} is {} (expires in {}s)",
                destination, code, props.ttlSeconds());
    }
}
