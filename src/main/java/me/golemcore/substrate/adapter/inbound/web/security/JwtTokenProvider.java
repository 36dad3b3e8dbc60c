package me.golemcore.substrate.adapter.inbound.web.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.domain.model.Caller;
import me.golemcore.substrate.domain.model.Privilege;
import me.golemcore.substrate.infrastructure.config.SubstrateProperties;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

/**
 * JWT creation and validation. The subject is the caller id and the
 * {@code privilege} claim its privilege level. Tokens are issued by the
 * external identity collaborator; {@link #generateToken} serves tests and
 * tooling.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String PRIVILEGE_CLAIM = "privilege";
    private static final int MIN_SECRET_BYTES = 32;

    private final SubstrateProperties properties;
    private SecretKey signingKey;

    public JwtTokenProvider(SubstrateProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        String secret = properties.getSecurity().getJwtSecret();
        if (secret == null || secret.isBlank()) {
            byte[] randomBytes = new byte[64];
            new SecureRandom().nextBytes(randomBytes);
            secret = Base64.getEncoder().encodeToString(randomBytes);
            log.warn("[API] No JWT secret configured, generated ephemeral secret (tokens won't survive restart)");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            byte[] padded = new byte[MIN_SECRET_BYTES];
            System.arraycopy(keyBytes, 0, padded, 0, Math.min(keyBytes.length, MIN_SECRET_BYTES));
            keyBytes = padded;
        }
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateToken(String callerId, Privilege privilege) {
        Instant now = Instant.now();
        Duration expiration = Duration.ofMinutes(properties.getSecurity().getJwtExpirationMinutes());
        return Jwts.builder()
                .subject(callerId)
                .claim(PRIVILEGE_CLAIM, privilege.name())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiration)))
                .signWith(signingKey)
                .compact();
    }

    public boolean validateToken(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[API] Invalid JWT: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Caller described by a valid token; empty when the privilege claim is
     * missing or unknown.
     */
    public Optional<Caller> getCaller(String token) {
        Claims claims = parseClaims(token);
        String privilege = claims.get(PRIVILEGE_CLAIM, String.class);
        if (privilege == null || claims.getSubject() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Caller(claims.getSubject(), Privilege.valueOf(privilege)));
        } catch (IllegalArgumentException e) {
            log.debug("[API] Rejected token with privilege claim {}", privilege);
            return Optional.empty();
        }
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
