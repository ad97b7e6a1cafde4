package com.feedrelay.auth;

import com.feedrelay.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Authenticates API clients by key/secret and issues the JWTs the REST API expects.
 *
 * <p>The same key/secret check guards the push channel, which takes the credentials as query
 * parameters instead of a bearer token. Tokens are HS256-signed; the subject is the client id.
 */
@Service
public class ClientAuthService {

    private static final Logger log = LoggerFactory.getLogger(ClientAuthService.class);

    private final AuthProperties authProperties;
    private final SecretKey secretKey;

    public ClientAuthService(AuthProperties authProperties) {
        this.authProperties = authProperties;
        this.secretKey = new SecretKeySpec(authProperties.getJwtSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    /**
     * Resolves a client id from a key/secret pair.
     *
     * @return the client id, or empty when the key is unknown, the secret is wrong or the client
     *     is inactive
     */
    public Optional<String> resolveClient(String clientKey, String clientSecret) {
        if (clientKey == null || clientSecret == null) {
            return Optional.empty();
        }
        return authProperties.getClients().stream()
                .filter(client -> client.isActive() && clientKey.equals(client.getClientKey()))
                .filter(client -> secretMatches(client.getClientSecret(), clientSecret))
                .map(AuthProperties.Client::getClientId)
                .findFirst();
    }

    /**
     * Exchanges client credentials for a token.
     *
     * @throws UnauthorizedException if the credentials are invalid
     */
    public IssuedToken issueToken(String clientKey, String clientSecret) {
        String clientId = resolveClient(clientKey, clientSecret).orElseThrow(() -> {
            log.warn("Failed token request for client key: {}", clientKey);
            return new UnauthorizedException();
        });

        Instant now = Instant.now();
        Instant expiry = now.plus(authProperties.getTokenTtl());
        String token = Jwts.builder()
                .subject(clientId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(secretKey)
                .compact();

        log.info("Issued token for client '{}'", clientId);
        return new IssuedToken(token, clientId, expiry);
    }

    /**
     * Validates the token and returns the client id it was issued to.
     *
     * @throws JwtException if the token is invalid, expired, or tampered
     */
    public String validateToken(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
        return claims.getSubject();
    }

    private static boolean secretMatches(String expected, String actual) {
        if (expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    public record IssuedToken(String token, String clientId, Instant expiresAt) {}
}
