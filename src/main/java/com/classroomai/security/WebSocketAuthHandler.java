package com.classroomai.security;

import com.classroomai.model.ConnectionRole;
import com.classroomai.service.JwtService;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;

import java.util.Optional;

/**
 * Authenticates lesson WebSocket handshakes.
 * The token is read from {@code Authorization: Bearer <JWT>} or, for browser clients that
 * cannot set headers, from the {@code token} query parameter.
 */
@Component
public class WebSocketAuthHandler {

    private static final Logger log = LoggerFactory.getLogger(WebSocketAuthHandler.class);
    static final String TOKEN_PARAM = "token";

    private final JwtService jwtService;

    public WebSocketAuthHandler(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    /**
     * Authenticate from handshake headers and query parameters.
     * Returns empty if no valid token was presented.
     */
    public Optional<AuthenticatedUser> authenticate(HttpHeaders headers, MultiValueMap<String, String> queryParams) {
        String token = extractToken(headers, queryParams);

        if (token == null || token.isEmpty()) {
            log.debug("No token provided for WebSocket connection");
            return Optional.empty();
        }

        try {
            Claims claims = jwtService.validateToken(token);
            String username = claims.getSubject();
            String role = claims.get("role", String.class);

            if (username != null) {
                log.debug("WebSocket authenticated for user: {}", username);
                return Optional.of(new AuthenticatedUser(username, role));
            }
        } catch (JwtException e) {
            log.debug("WebSocket authentication failed: {}", e.getMessage());
        }

        return Optional.empty();
    }

    private String extractToken(HttpHeaders headers, MultiValueMap<String, String> queryParams) {
        if (headers != null) {
            String fromHeader = jwtService.extractTokenFromHeader(headers.getFirst(HttpHeaders.AUTHORIZATION));
            if (fromHeader != null) {
                return fromHeader;
            }
        }
        if (queryParams != null) {
            String fromQuery = queryParams.getFirst(TOKEN_PARAM);
            if (fromQuery != null && !fromQuery.isBlank()) {
                return fromQuery.trim();
            }
        }
        return null;
    }

    /**
     * Authenticated user details.
     */
    public record AuthenticatedUser(String username, String role) {
        public ConnectionRole connectionRole() {
            return ConnectionRole.fromTokenRole(role);
        }
    }
}
