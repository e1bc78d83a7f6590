package com.example.campusevents.security;

import com.example.campusevents.entities.AppUser;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtTokenProvider")
class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-42";

    private final MutableClock clock = MutableClock.at("2025-03-14T09:00:00Z");
    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 60, "campus-events", clock);

    private final AppUser user = AppUser.builder()
            .id(UUID.randomUUID())
            .email("alice@campus.edu")
            .password("x")
            .role(UserRole.STUDENT)
            .build();

    @Test
    void roundTripsUserId() {
        String token = provider.createToken(user);

        assertThat(provider.parseUserId(token)).contains(user.getId());
    }

    @Test
    void rejectsExpiredToken() {
        String token = provider.createToken(user);
        clock.advance(Duration.ofMinutes(61));

        assertThat(provider.parseUserId(token)).isEmpty();
    }

    @Test
    @DisplayName("tokens signed with another key or issuer are rejected")
    void rejectsForeignTokens() {
        String foreignKey = new JwtTokenProvider("another-secret-another-secret-another", 60, "campus-events", clock).createToken(user);
        String foreignIssuer = new JwtTokenProvider(SECRET, 60, "someone-else", clock).createToken(user);

        assertThat(provider.parseUserId(foreignKey)).isEmpty();
        assertThat(provider.parseUserId(foreignIssuer)).isEmpty();
        assertThat(provider.parseUserId("garbage")).isEmpty();
        assertThat(provider.parseUserId(null)).isEmpty();
    }

    @Test
    void refusesShortSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider("short", 60, "campus-events", clock))
                .isInstanceOf(IllegalStateException.class);
    }
}
