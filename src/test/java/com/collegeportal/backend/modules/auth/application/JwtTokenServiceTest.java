package com.collegeportal.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import com.collegeportal.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.collegeportal.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.collegeportal.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.collegeportal.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-for-college-portal-tokens-0123456789";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final long ACCESS_TTL = 900_000L;
    private static final long REFRESH_TTL = 604_800_000L;

    private final PortalUser user = TestEntities.user(
            UUID.randomUUID(), "hod@college.test", "Head", "Teacher", PortalRole.STAFF);

    @Test
    @DisplayName("issued access tokens carry the user's id, role and staff flag")
    void issueAndParse() {
        JwtTokenService service = service(Clock.fixed(NOW, ZoneOffset.UTC));

        TokenPairResponse pair = service.issueTokenPair(user, "opaque-refresh");
        ParsedToken parsed = service.parseAccessToken(pair.accessToken());

        assertThat(pair.refreshToken()).isEqualTo("opaque-refresh");
        assertThat(pair.expiresIn()).isEqualTo(900L);
        assertThat(pair.refreshExpiresIn()).isEqualTo(604_800L);
        assertThat(parsed.userId()).isEqualTo(user.getId());
        assertThat(parsed.email()).isEqualTo("hod@college.test");
        assertThat(parsed.role()).isEqualTo(PortalRole.STAFF);
        assertThat(parsed.staff()).isTrue();
        assertThat(parsed.expiresAt().toInstant()).isEqualTo(NOW.plusMillis(ACCESS_TTL));
    }

    @Test
    @DisplayName("expired access tokens are rejected")
    void expiredTokenRejected() {
        String token = service(Clock.fixed(NOW, ZoneOffset.UTC)).issueTokenPair(user, "r").accessToken();
        JwtTokenService later = service(Clock.fixed(NOW.plusMillis(ACCESS_TTL + 60_000L), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("tokens signed with another key are rejected")
    void foreignSignatureRejected() {
        String token = service(Clock.fixed(NOW, ZoneOffset.UTC)).issueTokenPair(user, "r").accessToken();
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-secret-that-is-long-enough-for-hs256-0000"),
                ACCESS_TTL, REFRESH_TTL, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(() -> other.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("garbage is rejected")
    void garbageRejected() {
        JwtTokenService service = service(Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(() -> service.parseAccessToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }

    private static JwtTokenService service(Clock clock) {
        return new JwtTokenService(new JwtTokenProvider(SECRET), ACCESS_TTL, REFRESH_TTL, clock);
    }
}
