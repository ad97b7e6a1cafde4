package com.feedrelay.api.controller;

import com.feedrelay.api.dto.request.TokenRequest;
import com.feedrelay.api.dto.response.TokenResponse;
import com.feedrelay.auth.ClientAuthService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues bearer tokens to API clients. The only /api endpoint that needs no token.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final ClientAuthService clientAuthService;

    public AuthController(ClientAuthService clientAuthService) {
        this.clientAuthService = clientAuthService;
    }

    @PostMapping("/token")
    public ResponseEntity<TokenResponse> token(@Valid @RequestBody TokenRequest request) {
        ClientAuthService.IssuedToken issued =
                clientAuthService.issueToken(request.getClientKey(), request.getClientSecret());
        return ResponseEntity.ok(TokenResponse.builder()
                .token(issued.token())
                .clientId(issued.clientId())
                .expiresAt(issued.expiresAt())
                .build());
    }
}
