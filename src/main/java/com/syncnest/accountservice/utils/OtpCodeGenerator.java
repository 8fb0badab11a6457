package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.config.OtpProperties;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import dev.samstevens.totp.time.TimeProvider;
import org.springframework.stereotype.Component;

/**
 * RFC 6238 code over a fresh random Base32 secret per call, with a time step equal to the
 * code lifetime. The secret is discarded; only the hash of the code is ever stored.
 */
@Component
public class OtpCodeGenerator {

    private final SecretGenerator secretGenerator = new DefaultSecretGenerator();
    private final CodeGenerator codeGenerator;
    private final TimeProvider timeProvider;
    private final long period;

    public OtpCodeGenerator(OtpProperties props, TimeProvider timeProvider) {
        this.codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, props.digits());
        this.timeProvider = timeProvider;
        this.period = props.ttlSeconds();
    }

    public String generate() {
        String secret = secretGenerator.generate();
        long counter = Math.floorDiv(timeProvider.getTime(), period);
        try {
            return codeGenerator.generate(secret, counter);
        } catch (CodeGenerationException e) {
            throw new IllegalStateException("Failed to generate one-time code", e);
        }
    }
}
