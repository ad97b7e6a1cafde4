package com.feedrelay.unit.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.feedrelay.auth.AuthProperties;
import com.feedrelay.auth.ClientAuthService;
import com.feedrelay.exception.UnauthorizedException;
import io.jsonwebtoken.JwtException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClientAuthServiceTest {

    private static final String JWT_SECRET = "test-secret-that-is-at-least-256-bits-long-for-hmac";

    private AuthProperties authProperties;
    private ClientAuthService clientAuthService;

    @BeforeEach
    void setUp() {
        authProperties = new AuthProperties();
        authProperties.setJwtSecret(JWT_SECRET);
        authProperties.setTokenTtl(Duration.ofHours(1));
        authProperties.setClients(List.of(client("client-a", "ck_a", "cs_a", true), client("client-b", "ck_b", "cs_b", false)));
        clientAuthService = new ClientAuthService(authProperties);
    }

    private static AuthProperties.Client client(String id, String key, String secret, boolean active) {
        AuthProperties.Client client = new AuthProperties.Client();
        client.setClientId(id);
        client.setClientKey(key);
        client.setClientSecret(secret);
        client.setActive(active);
        return client;
    }

    @Test
    @DisplayName("Resolves an active client with the right secret")
    void resolvesClient() {
        assertThat(clientAuthService.resolveClient("ck_a", "cs_a")).contains("client-a");
    }

    @Test
    @DisplayName("Wrong secret, unknown key, inactive client and missing values resolve to nothing")
    void rejectsBadCredentials() {
        assertThat(clientAuthService.resolveClient("ck_a", "cs_wrong")).isEmpty();
        assertThat(clientAuthService.resolveClient("ck_unknown", "cs_a")).isEmpty();
        assertThat(clientAuthService.resolveClient("ck_b", "cs_b")).isEmpty();
        assertThat(clientAuthService.resolveClient(null, "cs_a")).isEmpty();
        assertThat(clientAuthService.resolveClient("ck_a", null)).isEmpty();
    }

    @Test
    @DisplayName("Issued token validates back to the client id and expires after the ttl")
    void issuesAndValidatesToken() {
        Instant before = Instant.now();

        ClientAuthService.IssuedToken issued = clientAuthService.issueToken("ck_a", "cs_a");

        assertThat(issued.clientId()).isEqualTo("client-a");
        assertThat(issued.expiresAt()).isBetween(before.plus(Duration.ofMinutes(59)), before.plus(Duration.ofMinutes(61)));
        assertThat(clientAuthService.validateToken(issued.token())).isEqualTo("client-a");
    }

    @Test
    @DisplayName("Invalid credentials are refused with UnauthorizedException")
    void refusesToken() {
        assertThatThrownBy(() -> clientAuthService.issueToken("ck_a", "cs_wrong"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid client credentials");
    }

    @Test
    @DisplayName("Tokens signed with another key are rejected")
    void rejectsForeignToken() {
        AuthProperties other = new AuthProperties();
        other.setJwtSecret("another-secret-that-is-also-at-least-256-bits-long");
        other.setClients(authProperties.getClients());
        String foreign = new ClientAuthService(other).issueToken("ck_a", "cs_a").token();

        assertThatThrownBy(() -> clientAuthService.validateToken(foreign)).isInstanceOf(JwtException.class);
        assertThatThrownBy(() -> clientAuthService.validateToken("not-a-jwt")).isInstanceOf(JwtException.class);
    }
}
