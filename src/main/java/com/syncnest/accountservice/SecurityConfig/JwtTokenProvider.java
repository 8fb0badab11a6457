package com.syncnest.accountservice.SecurityConfig;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.Date;
import java.util.UUID;

/**
 * HS256 access tokens with subject = account e-mail. Issuer and audience are enforced only
 * when configured.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private final long jwtExpirationMs;
    private final String issuer;
    private final String audience;
    private final SecretKey signingKey;
    private final JwtParser jwtParser;

    public JwtTokenProvider(@Value("${token.key.secret}") String secret,
                            @Value("${token.key.jwtExpiration}") long jwtExpirationMs,
                            @Value("${token.key.issuer:}") String issuer,
                            @Value("${token.key.audience:}") String audience) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        if (keyBytes.length < 32) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }

        this.jwtExpirationMs = Math.max(0, jwtExpirationMs);
        this.issuer = issuer;
        this.audience = audience;
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);

        JwtParserBuilder parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clockSkewSeconds(30);
        if (hasText(issuer)) {
            parserBuilder = parserBuilder.requireIssuer(issuer);
        }
        if (hasText(audience)) {
            parserBuilder = parserBuilder.requireAudience(audience);
        }
        this.jwtParser = parserBuilder.build();
    }

    public String generateToken(String email) {
        long now = System.currentTimeMillis();
        var builder = Jwts.builder()
                .id(UUID.randomUUID().toString().replace("-", ""))
                .subject(email)
                .issuedAt(new Date(now))
                .notBefore(new Date(now))
                .expiration(new Date(now + jwtExpirationMs));
        if (hasText(issuer)) {
            builder.issuer(issuer);
        }
        if (hasText(audience)) {
            builder.audience().add(audience).and();
        }
        return builder.signWith(signingKey, Jwts.SIG.HS256).compact();
    }

    /** Subject of a token whose signature and required claims check out. */
    public String extractEmail(String token) {
        return parse(token).getSubject();
    }

    /** Signature, expiry and subject match against {@code userDetails}. */
    public boolean validateToken(String token, UserDetails userDetails) {
        try {
            Claims claims = parse(token);
            Date exp = claims.getExpiration();
            if (claims.getSubject() == null || userDetails == null) return false;
            if (exp != null && exp.before(new Date())) return false;
            return claims.getSubject().equals(userDetails.getUsername());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public long getTokenValiditySeconds() {
        return jwtExpirationMs / 1000;
    }

    private Claims parse(String token) {
        try {
            return jwtParser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT: {}", e.getMessage());
            throw new IllegalArgumentException("Failed to parse JWT token.", e);
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
