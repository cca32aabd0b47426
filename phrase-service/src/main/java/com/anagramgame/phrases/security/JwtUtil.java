package com.anagramgame.phrases.security;

import com.anagramgame.phrases.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Validates bearer tokens issued by the registration service.
 */
@Component
public class JwtUtil {

    public static final String PLAYER_ID_CLAIM = "player_id";
    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;

    public JwtUtil(@Value("${jwt.secret}") String secret) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extract player ID from an Authorization header value
     */
    public UUID extractPlayerIdFromHeader(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            throw new InvalidTokenException("Missing or malformed Authorization header");
        }
        return extractPlayerId(authHeader.substring(BEARER_PREFIX.length()).trim());
    }

    /**
     * Extract player ID from JWT token, read from the player_id claim or else the subject
     */
    public UUID extractPlayerId(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }

        Object playerIdObj = claims.get(PLAYER_ID_CLAIM);
        if (playerIdObj == null) {
            playerIdObj = claims.getSubject();
        }
        if (playerIdObj instanceof String) {
            try {
                return UUID.fromString((String) playerIdObj);
            } catch (IllegalArgumentException e) {
                throw new InvalidTokenException("Invalid player_id claim in token", e);
            }
        }

        throw new InvalidTokenException("Token does not identify a player");
    }
}
