package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.config.ExecutorConfig;
import com.syncnest.accountservice.config.OtpMailProperties;
import com.syncnest.accountservice.service.OtpDeliveryChannel;
import com.syncnest.accountservice.utils.OtpEmailTemplate;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Sends codes as multipart (text + HTML) mail on the mail scheduler. A failed send is
 * retried {@code app.mail.max-retries} times with exponential backoff, then logged and dropped.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.mail", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MailOtpDeliveryChannel implements OtpDeliveryChannel {

    private final JavaMailSender mailSender;
    private final TaskScheduler scheduler;
    private final OtpEmailTemplate template;
    private final OtpMailProperties props;
    private final Clock clock;

    @Autowired
    public MailOtpDeliveryChannel(JavaMailSender mailSender,
                                  @Qualifier(ExecutorConfig.OTP_MAIL_SCHEDULER) TaskScheduler scheduler,
                                  OtpEmailTemplate template,
                                  OtpMailProperties props) {
        this(mailSender, scheduler, template, props, Clock.systemUTC());
    }

    MailOtpDeliveryChannel(JavaMailSender mailSender,
                           TaskScheduler scheduler,
                           OtpEmailTemplate template,
                           OtpMailProperties props,
                           Clock clock) {
        this.mailSender = mailSender;
        this.scheduler = scheduler;
        this.template = template;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public void dispatch(String destination, String code) {
        schedule(destination, code, 0, Duration.ZERO);
    }

    private void schedule(String destination, String code, int attempt, Duration delay) {
        try {
            scheduler.schedule(() -> send(destination, code, attempt), Instant.now(clock).plus(delay));
        } catch (TaskRejectedException e) {
            log.error("OTP mail to {} not scheduled (attempt {})", destination, attempt + 1, e);
        }
    }

    private void send(String destination, String code, int attempt) {
        try {
            mailSender.send(buildMessage(destination, code));
            log.info("OTP mail sent to {} (attempt {})", destination, attempt + 1);
        } catch (MailException | MessagingException e) {
            if (attempt < props.maxRetries()) {
                Duration backoff = props.backoffFor(attempt);
                log.warn("OTP mail to {} failed (attempt {}), retrying in {}s: {}",
                        destination, attempt + 1, backoff.toSeconds(), e.getMessage());
                schedule(destination, code, attempt + 1, backoff);
            } else {
                log.error("OTP mail to {} failed after {} attempts", destination, attempt + 1, e);
            }
        }
    }

    private MimeMessage buildMessage(String destination, String code) throws MessagingException {
        MimeMessage message = mailSender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
        helper.setFrom(props.from());
        helper.setTo(destination);
        helper.setSubject(props.subject());
        helper.setText(template.text(code), template.html(code));
        return message;
    }
}
