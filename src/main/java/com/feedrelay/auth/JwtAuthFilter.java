package com.feedrelay.auth;

import com.feedrelay.api.dto.response.ApiErrorResponse;
import com.feedrelay.exception.ErrorCode;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import tools.jackson.databind.ObjectMapper;

/**
 * Resolves the calling client from the bearer token of every /api request.
 *
 * <p>The resolved client id is stored in the {@value #CLIENT_ATTRIBUTE} request attribute;
 * subscription and webhook controllers scope all reads and writes to it. Requests without a
 * valid token never reach a controller. Registered via {@link com.feedrelay.config.WebConfig}.
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String CLIENT_ATTRIBUTE = "authenticatedClient";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    private static final String BEARER = "Bearer ";
    private static final Set<String> OPEN_PATHS = Set.of("/api/auth/token");

    private final ClientAuthService clientAuthService;
    private final ObjectMapper objectMapper;

    public JwtAuthFilter(ClientAuthService clientAuthService, ObjectMapper objectMapper) {
        this.clientAuthService = clientAuthService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return OPEN_PATHS.contains(request.getRequestURI()) || "OPTIONS".equals(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER)) {
            reject(request, response, "Missing or invalid Authorization header");
            return;
        }

        String clientId;
        try {
            clientId = clientAuthService.validateToken(header.substring(BEARER.length()).trim());
        } catch (JwtException e) {
            log.debug("Rejected token on {}: {}", request.getRequestURI(), e.getMessage());
            reject(request, response, "Invalid or expired token");
            return;
        }

        request.setAttribute(CLIENT_ATTRIBUTE, clientId);
        chain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String reason) throws IOException {
        response.setStatus(ErrorCode.UNAUTHORIZED.status().value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(
                response.getOutputStream(),
                ApiErrorResponse.of(ErrorCode.UNAUTHORIZED, reason, null, request.getRequestURI()));
    }
}
