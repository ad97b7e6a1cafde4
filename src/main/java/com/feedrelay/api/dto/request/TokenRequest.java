package com.feedrelay.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client credentials exchanged for a bearer token at POST /api/auth/token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRequest {

    @NotBlank
    @JsonProperty("client_key")
    private String clientKey;

    @NotBlank
    @JsonProperty("client_secret")
    private String clientSecret;
}
