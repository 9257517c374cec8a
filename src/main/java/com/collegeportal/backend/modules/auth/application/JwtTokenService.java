package com.collegeportal.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.collegeportal.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 access tokens. Refresh tokens are opaque and tracked by
 * {@link AuthService}; this class only reports their lifetime.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_STAFF = "staff";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public TokenPairResponse issueTokenPair(PortalUser user, String refreshToken) {
        Instant now = clock.instant();
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(now, clock.getZone());

        String accessToken = Jwts.builder()
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_STAFF, user.isStaff())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                refreshToken,
                refreshTokenTtlMillis / 1000L,
                issuedAt
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String roleClaim = claims.get(CLAIM_ROLE, String.class);
            if (subject == null || roleClaim == null) {
                throw new InvalidTokenException("Access token is missing required claims", null);
            }
            UUID userId = UUID.fromString(subject);
            String email = claims.get(CLAIM_EMAIL, String.class);
            PortalRole role = PortalRole.valueOf(roleClaim);
            boolean staff = Boolean.TRUE.equals(claims.get(CLAIM_STAFF, Boolean.class));
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    email,
                    role,
                    staff,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    public record ParsedToken(
            UUID userId,
            String email,
            PortalRole role,
            boolean staff,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
