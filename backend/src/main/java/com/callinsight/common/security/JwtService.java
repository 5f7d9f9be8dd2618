package com.callinsight.common.security;

import com.callinsight.common.exception.UnauthorizedException;
import com.callinsight.config.AppProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

@Service
public class JwtService {

    private final AppProperties properties;
    private SecretKey secretKey;

    public JwtService(AppProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void initKey() {
        byte[] source = properties.jwt().secret().getBytes(StandardCharsets.UTF_8);
        if (source.length < 32) {
            byte[] expanded = new byte[32];
            for (int i = 0; i < expanded.length; i++) {
                expanded[i] = source[i % source.length];
            }
            source = expanded;
        }
        this.secretKey = Keys.hmacShaKeyFor(source);
    }

    public String issueAccessToken(String subject, String role, Duration ttl) {
        Instant now = Instant.now();
        return Jwts.builder()
                .issuer(properties.jwt().issuer())
                .subject(subject)
                .claims(Map.of(
                        "role", role,
                        "type", "access",
                        "jti", UUID.randomUUID().toString()
                ))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(secretKey)
                .compact();
    }

    public ParsedToken parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .requireIssuer(properties.jwt().issuer())
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String role = claims.get("role", String.class);
            String tokenType = claims.get("type", String.class);
            Date expiration = claims.getExpiration();

            if (subject == null || tokenType == null || expiration == null) {
                throw new UnauthorizedException("Invalid token payload");
            }

            return new ParsedToken(subject, role == null ? "USER" : role, tokenType, expiration.toInstant());
        } catch (IllegalArgumentException | JwtException exception) {
            throw new UnauthorizedException("Invalid or expired token");
        }
    }

    public record ParsedToken(
            String subject,
            String role,
            String tokenType,
            Instant expiresAt
    ) {
    }
}
