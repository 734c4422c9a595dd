package com.vaultwave.backend.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Verifies bearer tokens issued by the identity service. Tokens are HS256-signed with the shared
 * {@code security.jwt.secret}; the subject is the user's email.
 */
@Service
public class JwtService {

    private final JwtParser parser;

    public JwtService(@Value("${security.jwt.secret}") String secret) {
        this.parser = Jwts.parserBuilder()
                .setSigningKey(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .setAllowedClockSkewSeconds(5)
                .build();
    }

    /**
     * @throws JwtException when the token is malformed, expired or signed with another key
     */
    public AccessToken read(String token) {
        Claims claims = parser.parseClaimsJws(token).getBody();
        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw new JwtException("Token has no subject");
        }
        return new AccessToken(claims.getSubject(), claims.get("role", String.class));
    }

    public record AccessToken(String email, String role) {
    }
}
