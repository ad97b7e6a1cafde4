package com.feedrelay.auth;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * API client credentials and token settings.
 *
 * <pre>
 * feedrelay.auth.jwt-secret=...
 * feedrelay.auth.token-ttl=24h
 * feedrelay.auth.clients[0].client-id=client-1
 * feedrelay.auth.clients[0].client-key=ck_demo
 * feedrelay.auth.clients[0].client-secret=cs_demo
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "feedrelay.auth")
public class AuthProperties {

    private String jwtSecret;
    private Duration tokenTtl = Duration.ofHours(24);
    private List<Client> clients = new ArrayList<>();

    @Data
    public static class Client {
        private String clientId;
        private String clientKey;
        private String clientSecret;
        private boolean active = true;
    }
}
