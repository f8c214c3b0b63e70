package com.titanic.inference.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Reads a token's payload without checking its signature. The result is for
 * log diagnostics only; it is not a {@link CallerIdentity}.
 */
@Component
public class UnverifiedTokenInspector {
    private final ObjectMapper objectMapper;

    public UnverifiedTokenInspector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<UnverifiedClaims> inspect(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] segments = token.trim().split("\\.", -1);
        if (segments.length != 3) {
            return Optional.empty();
        }
        try {
            JsonNode payload = objectMapper.readTree(Base64.getUrlDecoder().decode(segments[1]));
            if (payload == null || !payload.isObject()) {
                return Optional.empty();
            }
            Instant expiresAt = payload.path("exp").isNumber()
                ? Instant.ofEpochSecond(payload.path("exp").asLong())
                : null;
            return Optional.of(new UnverifiedClaims(
                payload.path("iss").asText(null),
                payload.path("sub").asText(null),
                expiresAt
            ));
        } catch (IllegalArgumentException | IOException ex) {
            return Optional.empty();
        }
    }

    public record UnverifiedClaims(String statedIssuer, String statedSubject, Instant statedExpiry) {
    }
}
