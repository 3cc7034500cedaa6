package com.cleanwater.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import com.cleanwater.backend.global.config.SecurityProperties;
import com.cleanwater.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.cleanwater.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String TYPE_CLAIM = "type";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtTokenService(JwtTokenProvider tokenProvider, SecurityProperties properties, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = properties.jwt().accessTokenTtl();
        this.refreshTokenTtl = properties.jwt().refreshTokenTtl();
        this.clock = clock;
    }

    public TokenPairResponse issueTokenPair(String username) {
        Instant now = clock.instant();
        String accessToken = sign(username, TokenType.ACCESS, now, now.plus(accessTokenTtl));
        String refreshToken = sign(username, TokenType.REFRESH, now, now.plus(refreshTokenTtl));
        return new TokenPairResponse(
                accessToken,
                refreshToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtl.toSeconds(),
                refreshTokenTtl.toSeconds()
        );
    }

    /**
     * Verifies signature, expiry and the {@code type} claim.
     *
     * @return the subject (username)
     * @throws InvalidTokenException for any token that must not be trusted
     */
    public String verify(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty", null);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid " + expectedType.getClaimValue() + " token", e);
        }

        if (claims.getExpiration() == null) {
            throw new InvalidTokenException("Token has no expiry", null);
        }
        if (!expectedType.getClaimValue().equals(claims.get(TYPE_CLAIM, String.class))) {
            throw new InvalidTokenException("Unexpected token type", null);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("Token has no subject", null);
        }
        return subject;
    }

    private String sign(String username, TokenType type, Instant issuedAt, Instant expiresAt) {
        SecretKey key = tokenProvider.getSecretKey();
        return Jwts.builder()
                .subject(username)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(TYPE_CLAIM, type.getClaimValue())
                .signWith(key, SIG.HS256)
                .compact();
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
