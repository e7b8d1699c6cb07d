package com.classroomai.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Validates HS256 access tokens issued by the authentication service.
 * Tokens carry the user in {@code sub} and the user's role in the {@code role} claim.
 */
@Service
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey signingKey;
    private final String issuer;

    public JwtService(
            @Value("${security.jwt.secret:}") String secret,
            @Value("${security.jwt.issuer:classroom-ai}") String issuer) {

        // No secret configured: generate one (dev mode, no externally issued token will validate)
        if (secret == null || secret.isBlank()) {
            byte[] randomKey = new byte[64];
            SECURE_RANDOM.nextBytes(randomKey);
            secret = Base64.getEncoder().encodeToString(randomKey);
            log.warn("JWT_SECRET not set, generated a random key. Set JWT_SECRET to accept issued tokens.");
        }

        // HS256 needs at least 256 bits
        if (secret.length() < 32) {
            throw new IllegalArgumentException("JWT secret must be at least 256 bits (32 characters)");
        }

        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;

        log.info("JwtService initialized for issuer '{}'", issuer);
    }

    /**
     * Validate a token and return the claims if valid.
     */
    public Claims validateToken(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(issuer)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("Token expired: {}", e.getMessage());
            throw e;
        } catch (JwtException e) {
            log.debug("Invalid token: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Extract token from Authorization header.
     */
    public String extractTokenFromHeader(String authHeader) {
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
